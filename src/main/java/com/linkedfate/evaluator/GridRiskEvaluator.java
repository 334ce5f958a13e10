package com.linkedfate.evaluator;

import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.GridPayload;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * ERCOT grid evaluator. Reserve margin = (generation - demand) / generation * 100, matched
 * against the reserve margin cascade. Without a positive generation reading it reports demand
 * only, at NORMAL.
 */
@Component
@EnableConfigurationProperties({EvaluatorThresholds.class, RiskEngineConfig.class})
public class GridRiskEvaluator extends AbstractDomainEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GridRiskEvaluator.class);

    public static final String DEMAND = "GRID_DEMAND";
    public static final String GENERATION = "GRID_GENERATION";

    private final ObservationJpaRepository observationJpaRepository;
    private final EvaluatorThresholds evaluatorThresholds;

    public GridRiskEvaluator(
            IndicatorJpaRepository indicatorJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            EvaluatorThresholds evaluatorThresholds,
            RiskEngineConfig riskEngineConfig,
            Clock clock) {
        super(indicatorJpaRepository, clock, riskEngineConfig.getRegionCode());
        this.observationJpaRepository = observationJpaRepository;
        this.evaluatorThresholds = evaluatorThresholds;
    }

    @Override
    public Domain domain() {
        return Domain.GRID;
    }

    @Override
    public Alert evaluate() {
        OptionalDouble demand = latestValue(DEMAND);
        if (demand.isEmpty()) {
            return newAlert(
                    AlertLevel.NORMAL,
                    "GRID_NORMAL",
                    "ERCOT demand data not yet available",
                    GridPayload.builder().indicatorCode(DEMAND).build());
        }
        OptionalDouble generation = latestValue(GENERATION);
        Alert alert = generation.isPresent() && generation.getAsDouble() > 0
                ? evaluateMargin(demand.getAsDouble(), generation.getAsDouble())
                : demandOnly(demand.getAsDouble());
        log.debug("Grid evaluated: {} {}", alert.getCode(), alert.getMessage());
        return alert;
    }

    /** Reserve margin percentage, or NaN when generation is not positive. */
    public static double reserveMargin(double demand, double generation) {
        if (generation <= 0) {
            return Double.NaN;
        }
        return (generation - demand) / generation * 100.0;
    }

    private Alert evaluateMargin(double demand, double generation) {
        double margin = reserveMargin(demand, generation);
        GridPayload.GridPayloadBuilder payload = GridPayload.builder()
                .indicatorCode(DEMAND)
                .demandMw(demand)
                .generationMw(generation)
                .reserveMarginPct(margin);

        Optional<ThresholdTier> tier = evaluatorThresholds.gridReserveMarginCascade().match(margin);
        if (tier.isEmpty()) {
            return newAlert(
                    AlertLevel.NORMAL,
                    "GRID_NORMAL",
                    String.format("ERCOT Grid Normal: %,.0f MW demand", demand),
                    payload.build());
        }
        ThresholdTier matched = tier.get();
        String message = switch (matched.getLevel()) {
            case CRITICAL -> String.format("ERCOT RESERVE MARGIN CRITICAL: %.1f%%", margin);
            case WARNING -> String.format("ERCOT RESERVE MARGIN LOW: %.1f%%", margin);
            default -> String.format("ERCOT Reserve Margin: %.1f%%", margin);
        };
        return newAlert(
                matched.getLevel(),
                matched.getCode(),
                message,
                payload.threshold(matched.getCutoff()).build());
    }

    private Alert demandOnly(double demand) {
        return newAlert(
                AlertLevel.NORMAL,
                "GRID_NORMAL",
                String.format("ERCOT Demand: %,.0f MW", demand),
                GridPayload.builder().indicatorCode(DEMAND).demandMw(demand).build());
    }

    private OptionalDouble latestValue(String indicatorCode) {
        Optional<IndicatorEntity> indicator = indicator(indicatorCode);
        if (indicator.isEmpty()) {
            return OptionalDouble.empty();
        }
        Optional<ObservationEntity> latest = read(
                indicatorCode,
                () -> observationJpaRepository.findFirstByIndicatorIdOrderByObservedAtDesc(
                        indicator.get().getId()));
        return latest.map(o -> OptionalDouble.of(o.getValue())).orElse(OptionalDouble.empty());
    }
}
