package com.linkedfate.domain.model;

import com.linkedfate.domain.enums.Domain;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Non-physical signals available to the correlation engine in one cycle: market moves,
 * aggregated news sentiment per domain, forecasts, and derived metrics such as the grid
 * reserve margin.
 *
 * <p>Missing signals are simply absent; rules depending on them do not fire.
 */
@Getter
@Builder
public class CorrelationSignals {

    public static final String GRID_RESERVE_MARGIN = "GRID_RESERVE_MARGIN";

    @Singular
    private final List<MarketMove> marketMoves;

    @Singular("sentiment")
    private final Map<Domain, Double> sentimentByDomain;

    @Singular
    private final List<ForecastReading> forecasts;

    @Singular
    private final Map<String, Double> metrics;

    public static CorrelationSignals empty() {
        return CorrelationSignals.builder().build();
    }

    public Optional<Double> sentiment(Domain domain) {
        return Optional.ofNullable(sentimentByDomain.get(domain));
    }

    public Optional<Double> metric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public List<ForecastReading> forecasts(String indicatorCode) {
        return forecasts.stream()
                .filter(f -> indicatorCode.equals(f.getIndicatorCode()))
                .toList();
    }
}
