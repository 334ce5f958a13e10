package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import com.linkedfate.domain.model.ForecastReading;
import com.linkedfate.domain.model.MarketMove;
import com.linkedfate.domain.payload.CompositePayload;
import com.linkedfate.domain.payload.MarketPayload;
import com.linkedfate.domain.payload.PredictivePayload;
import com.linkedfate.evaluator.ThresholdCascade;
import com.linkedfate.evaluator.ThresholdTier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * The Linked Fate rule set, in evaluation order.
 *
 * <ol>
 *   <li>TEXAS_PERFECT_STORM: all three physical domains at WARNING or above. Overrides the
 *       pairwise physical rules.</li>
 *   <li>Pairwise physical rules: grid + port, water + grid.</li>
 *   <li>Market reactions: a domain at WARNING+ with a watchlist symbol moving at least the
 *       moderate tier.</li>
 *   <li>Sentiment confirmation per domain, then the triple confirmation (domain, sentiment and
 *       market together).</li>
 *   <li>Predictive rules on 48h forecasts: heat with a thin reserve margin, freeze, storm.</li>
 * </ol>
 */
@Component
@EnableConfigurationProperties(CorrelationConfig.class)
public class LinkedFateRuleTable {

    public static final String PERFECT_STORM = "TEXAS_PERFECT_STORM";
    public static final String SUPPLY_CHAIN_CRITICAL = "TEXAS_SUPPLY_CHAIN_CRITICAL";
    public static final String INFRASTRUCTURE_STRESS = "TEXAS_INFRASTRUCTURE_STRESS";
    public static final String MARKET_ENERGY_STRAIN = "MARKET_ENERGY_STRAIN";
    public static final String MARKET_WATER_STRESS = "MARKET_WATER_STRESS";
    public static final String MARKET_SUPPLY_CHAIN = "MARKET_SUPPLY_CHAIN";
    public static final String PREDICTIVE_GRID_STRAIN = "PREDICTIVE_GRID_STRAIN";
    public static final String PREDICTIVE_FREEZE = "PREDICTIVE_FREEZE";
    public static final String PREDICTIVE_PORT_CHOKEPOINT = "PREDICTIVE_PORT_CHOKEPOINT";

    static final String PHYSICAL_GROUP = "physical";

    public static final String FORECAST_MAX_TEMP = "FORECAST_MAX_TEMP_48H";
    public static final String FORECAST_MIN_TEMP = "FORECAST_MIN_TEMP_48H";
    public static final String FORECAST_STORM_ALERT = "FORECAST_STORM_ALERT";

    private final CorrelationConfig config;
    private final List<CorrelationRule> rules;

    public LinkedFateRuleTable(CorrelationConfig config) {
        this.config = config;
        this.rules = List.copyOf(buildRules());
        Set<String> codes = new HashSet<>();
        for (CorrelationRule rule : rules) {
            if (!codes.add(rule.getCode())) {
                throw new IllegalStateException("Duplicate correlation rule code: " + rule.getCode());
            }
        }
    }

    public List<CorrelationRule> rules() {
        return rules;
    }

    public static String sentimentCode(Domain domain) {
        return "SENTIMENT_" + domain.getCode() + "_STRESS";
    }

    public static String tripleCode(Domain domain) {
        return "TRIPLE_" + domain.getCode() + "_CONFIRMED";
    }

    private List<CorrelationRule> buildRules() {
        List<CorrelationRule> table = new ArrayList<>();

        table.add(CorrelationRule.builder()
                .code(PERFECT_STORM)
                .alertType(AlertType.LINKED)
                .condition(atLeastWarning(Domain.GRID))
                .condition(atLeastWarning(Domain.WATER))
                .condition(atLeastWarning(Domain.PORT))
                .group(PHYSICAL_GROUP)
                .overriding(true)
                .level(match -> AlertLevel.CRITICAL)
                .message(match -> "PERFECT STORM: Grid strain + Drought + Port congestion")
                .payload(match -> composite(match, null, null))
                .build());

        table.add(pairwise(
                SUPPLY_CHAIN_CRITICAL, Domain.GRID, Domain.PORT, "SUPPLY CHAIN RISK: Grid strain + Port congestion"));
        table.add(pairwise(
                INFRASTRUCTURE_STRESS,
                Domain.WATER,
                Domain.GRID,
                "INFRASTRUCTURE STRESS: Drought conditions + Grid strain"));

        table.add(marketReaction(
                MARKET_ENERGY_STRAIN, "ENERGY_STRAIN", Domain.GRID, "while ERCOT grid under %s conditions"));
        table.add(marketReaction(MARKET_WATER_STRESS, "WATER_STRESS", Domain.WATER, "during Texas water %s"));
        table.add(marketReaction(MARKET_SUPPLY_CHAIN, "SUPPLY_CHAIN", Domain.PORT, "during Port of Houston %s"));

        for (Domain domain : Domain.values()) {
            table.add(sentimentStress(domain));
        }
        for (Domain domain : Domain.values()) {
            table.add(tripleConfirmation(domain));
        }

        table.add(predictiveGridStrain());
        table.add(predictiveFreeze());
        table.add(predictivePortChokepoint());
        return table;
    }

    private CorrelationRule pairwise(String code, Domain first, Domain second, String message) {
        return CorrelationRule.builder()
                .code(code)
                .alertType(AlertType.LINKED)
                .group(PHYSICAL_GROUP)
                .condition(atLeastWarning(first))
                .condition(atLeastWarning(second))
                .level(LinkedFateRuleTable::criticalIfAnyCritical)
                .message(match -> message)
                .payload(match -> composite(match, null, null))
                .build();
    }

    private CorrelationRule marketReaction(String code, String reactionType, Domain domain, String context) {
        return CorrelationRule.builder()
                .code(code)
                .alertType(AlertType.MARKET)
                .condition(atLeastWarning(domain))
                .condition(marketMove(domain))
                .level(match -> match.require(Evidence.Kind.MARKET).getConfidence().compareTo(Confidence.MODERATE) >= 0
                        ? AlertLevel.WARNING
                        : AlertLevel.WATCH)
                .confidence(match -> match.require(Evidence.Kind.MARKET).getConfidence())
                .title(match -> String.format(
                        "Market Reaction: %s (%s)",
                        reactionType, match.require(Evidence.Kind.MARKET).getMove().getSymbol()))
                .message(match -> {
                    MarketMove move = match.require(Evidence.Kind.MARKET).getMove();
                    return String.format(
                            "MARKET REACTION: %s %s %.1f%% " + context,
                            move.getSymbol(),
                            move.direction(),
                            move.magnitude(),
                            match.maxDomainLevel());
                })
                .payload(match -> market(match, null))
                .build();
    }

    private CorrelationRule sentimentStress(Domain domain) {
        return CorrelationRule.builder()
                .code(sentimentCode(domain))
                .alertType(AlertType.LINKED)
                .condition(atLeastWarning(domain))
                .condition(sentiment(domain))
                .level(LinkedFateRuleTable::criticalIfAnyCritical)
                .confidence(match -> match.require(Evidence.Kind.SENTIMENT).getConfidence())
                .message(match -> String.format(
                        "SENTIMENT CONFIRMS %s STRESS: news sentiment %.2f during %s conditions",
                        domain.getCode(),
                        match.require(Evidence.Kind.SENTIMENT).getSentimentScore(),
                        match.maxDomainLevel()))
                .payload(match -> {
                    Evidence sentiment = match.require(Evidence.Kind.SENTIMENT);
                    return composite(match, sentiment.getSentimentScore(), sentiment.getConfidence());
                })
                .build();
    }

    private CorrelationRule tripleConfirmation(Domain domain) {
        return CorrelationRule.builder()
                .code(tripleCode(domain))
                .alertType(AlertType.MARKET)
                .condition(atLeastWarning(domain))
                .condition(sentiment(domain))
                .condition(marketMove(domain))
                .level(match -> AlertLevel.CRITICAL)
                .confidence(match -> Confidence.STRONG)
                .title(match -> String.format(
                        "Triple Confirmed: %s (%s)",
                        domain.getCode(), match.require(Evidence.Kind.MARKET).getMove().getSymbol()))
                .message(match -> {
                    MarketMove move = match.require(Evidence.Kind.MARKET).getMove();
                    return String.format(
                            "TRIPLE CONFIRMATION: %s %s + sentiment %.2f + %s %s %.1f%%",
                            domain.getCode(),
                            match.maxDomainLevel(),
                            match.require(Evidence.Kind.SENTIMENT).getSentimentScore(),
                            move.getSymbol(),
                            move.direction(),
                            move.magnitude());
                })
                .payload(match -> market(match, match.require(Evidence.Kind.SENTIMENT).getSentimentScore()))
                .build();
    }

    private CorrelationRule predictiveGridStrain() {
        ThresholdCascade heat = ThresholdCascade.of(
                ThresholdCascade.Direction.AT_OR_ABOVE,
                new ThresholdTier(AlertLevel.CRITICAL, "EXTREME_HEAT", config.getHeatExtremeF()),
                new ThresholdTier(AlertLevel.WARNING, "HIGH_HEAT", config.getHeatHighF()));
        return predictive(PREDICTIVE_GRID_STRAIN)
                .condition(new ForecastCondition(FORECAST_MAX_TEMP, heat))
                .condition(new MetricBelowCondition(CorrelationSignals.GRID_RESERVE_MARGIN, config.getLowMarginPct()))
                .message(match -> {
                    ForecastReading forecast = match.require(Evidence.Kind.FORECAST).getForecast();
                    return String.format(
                            "HEAT RISK %s: forecast high %.0f°F at %s with reserve margin %.1f%%",
                            config.getPredictionWindow(),
                            forecast.getValue(),
                            forecast.getLocation(),
                            match.require(Evidence.Kind.METRIC).getMetricValue());
                })
                .build();
    }

    private CorrelationRule predictiveFreeze() {
        ThresholdCascade freeze = ThresholdCascade.of(
                ThresholdCascade.Direction.AT_OR_BELOW,
                new ThresholdTier(AlertLevel.CRITICAL, "HARD_FREEZE", config.getHardFreezeF()),
                new ThresholdTier(AlertLevel.WARNING, "FREEZE_WARNING", config.getFreezeWarningF()));
        return predictive(PREDICTIVE_FREEZE)
                .condition(new ForecastCondition(FORECAST_MIN_TEMP, freeze))
                .message(match -> {
                    ForecastReading forecast = match.require(Evidence.Kind.FORECAST).getForecast();
                    return String.format(
                            "FREEZE RISK %s: forecast low %.0f°F at %s",
                            config.getPredictionWindow(), forecast.getValue(), forecast.getLocation());
                })
                .build();
    }

    private CorrelationRule predictivePortChokepoint() {
        ThresholdCascade storm = ThresholdCascade.of(
                ThresholdCascade.Direction.AT_OR_ABOVE,
                new ThresholdTier(AlertLevel.CRITICAL, "STORM_WARNING", config.getStormWarningLevel()),
                new ThresholdTier(AlertLevel.WARNING, "STORM_WATCH", config.getStormWatchLevel()));
        return predictive(PREDICTIVE_PORT_CHOKEPOINT)
                .condition(new ForecastCondition(FORECAST_STORM_ALERT, storm))
                .message(match -> {
                    Evidence forecast = match.require(Evidence.Kind.FORECAST);
                    return String.format(
                            "STORM RISK %s: tropical storm %s near %s, port closure likely",
                            config.getPredictionWindow(),
                            forecast.getLevel() == AlertLevel.CRITICAL ? "warning" : "watch",
                            forecast.getForecast().getLocation());
                })
                .build();
    }

    private CorrelationRule.CorrelationRuleBuilder predictive(String code) {
        return CorrelationRule.builder()
                .code(code)
                .alertType(AlertType.PREDICTIVE)
                .predictionWindow(config.getPredictionWindow())
                .title(match -> String.format(
                        "%s (%s)",
                        Alert.titleFromCode(code),
                        match.require(Evidence.Kind.FORECAST).getForecast().getLocation()))
                .payload(match -> {
                    Evidence forecast = match.require(Evidence.Kind.FORECAST);
                    return PredictivePayload.builder()
                            .ruleCode(code)
                            .location(forecast.getForecast().getLocation())
                            .forecastIndicator(forecast.getForecast().getIndicatorCode())
                            .forecastValue(forecast.getForecast().getValue())
                            .threshold(forecast.getThreshold())
                            .predictionWindow(config.getPredictionWindow())
                            .reserveMarginPct(match.first(Evidence.Kind.METRIC)
                                    .map(Evidence::getMetricValue)
                                    .orElse(null))
                            .build();
                });
    }

    private static DomainLevelCondition atLeastWarning(Domain domain) {
        return new DomainLevelCondition(domain, AlertLevel.WARNING);
    }

    private MarketMoveCondition marketMove(Domain domain) {
        return new MarketMoveCondition(
                config.symbolsFor(domain.getCode()), config.getMarketModerateMovePct(), config.getMarketStrongMovePct());
    }

    private SentimentCondition sentiment(Domain domain) {
        return new SentimentCondition(domain, config.getSentimentNegative(), config.getSentimentVeryNegative());
    }

    private static AlertLevel criticalIfAnyCritical(RuleMatch match) {
        return match.maxDomainLevel() == AlertLevel.CRITICAL ? AlertLevel.CRITICAL : AlertLevel.WARNING;
    }

    private static CompositePayload composite(RuleMatch match, Double sentimentScore, Confidence confidence) {
        return CompositePayload.builder()
                .ruleCode(match.getRule().getCode())
                .domainLevels(match.domainLevels())
                .sentimentScore(sentimentScore)
                .confidence(confidence)
                .build();
    }

    private static MarketPayload market(RuleMatch match, Double sentimentScore) {
        Evidence domain = match.require(Evidence.Kind.DOMAIN);
        Evidence market = match.require(Evidence.Kind.MARKET);
        MarketMove move = market.getMove();
        return MarketPayload.builder()
                .ruleCode(match.getRule().getCode())
                .symbol(move.getSymbol())
                .changePercent(move.getChangePercent())
                .direction(move.direction())
                .physicalDomain(domain.getDomain().getCode())
                .physicalAlert(domain.getAlertCode())
                .physicalLevel(domain.getLevel())
                .confidence(match.getRule().confidenceFor(match))
                .sentimentScore(sentimentScore)
                .build();
    }
}
