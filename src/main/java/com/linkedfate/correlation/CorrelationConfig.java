package com.linkedfate.correlation;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds for the correlation rules under the {@code linkedfate.correlation} prefix.
 *
 * <p>Temperatures are in °F, moves and margins in percent, sentiment in [-1, 1].
 * {@code watchlist} maps a domain code (GRID, WATR, FLOW) to the ticker symbols whose moves
 * are read as a market reaction to that domain.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "linkedfate.correlation")
public class CorrelationConfig {

    private double marketModerateMovePct = 2.0;
    private double marketStrongMovePct = 5.0;

    private double sentimentNegative = -0.2;
    private double sentimentVeryNegative = -0.5;

    private double heatHighF = 98.0;
    private double heatExtremeF = 100.0;
    private double freezeWarningF = 32.0;
    private double hardFreezeF = 25.0;

    /** Storm alert indicator values: 1 = watch/advisory, 2 = warning. */
    private double stormWatchLevel = 1.0;
    private double stormWarningLevel = 2.0;

    /** Reserve margin below which a heat forecast becomes a grid strain prediction. */
    private double lowMarginPct = 10.0;

    private String predictionWindow = "48h";

    /** Market, sentiment and forecast readings older than this are ignored. */
    private int signalMaxAgeHours = 24;

    /** Sentiment is averaged over this window per domain. */
    private int sentimentWindowHours = 6;

    private int maxSignalRows = 500;

    private Map<String, List<String>> watchlist = defaultWatchlist();

    @PostConstruct
    public void validate() {
        if (marketModerateMovePct <= 0 || marketStrongMovePct <= marketModerateMovePct) {
            throw new IllegalStateException("Market move tiers must satisfy 0 < moderate < strong");
        }
        if (sentimentNegative >= 0 || sentimentVeryNegative >= sentimentNegative) {
            throw new IllegalStateException("Sentiment tiers must satisfy veryNegative < negative < 0");
        }
        if (heatExtremeF <= heatHighF || hardFreezeF >= freezeWarningF || stormWarningLevel <= stormWatchLevel) {
            throw new IllegalStateException("Forecast tiers must be strictly ordered");
        }
        if (signalMaxAgeHours <= 0 || sentimentWindowHours <= 0 || maxSignalRows <= 0) {
            throw new IllegalStateException("Signal windows and row cap must be positive");
        }
    }

    public List<String> symbolsFor(String domainCode) {
        return watchlist.getOrDefault(domainCode, List.of());
    }

    private static Map<String, List<String>> defaultWatchlist() {
        Map<String, List<String>> watchlist = new LinkedHashMap<>();
        watchlist.put("GRID", List.of("VST", "NRG"));
        watchlist.put("WATR", List.of("TXN"));
        watchlist.put("FLOW", List.of("TXN"));
        return watchlist;
    }
}
