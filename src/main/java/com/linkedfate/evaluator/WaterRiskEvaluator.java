package com.linkedfate.evaluator;

import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.WaterPayload;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.repository.jpa.AnomalyJpaRepository;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Groundwater evaluator. Works off the unacknowledged GW_LEVEL anomalies of the last water
 * lookback window (24h by default) rather than raw levels: any anomaly at or above the
 * critical severity makes the aquifer CRITICAL, otherwise the anomaly count decides.
 */
@Component
@EnableConfigurationProperties({EvaluatorThresholds.class, RiskEngineConfig.class})
public class WaterRiskEvaluator extends AbstractDomainEvaluator {

    public static final String GW_LEVEL = "GW_LEVEL";

    private final ObservationJpaRepository observationJpaRepository;
    private final AnomalyJpaRepository anomalyJpaRepository;
    private final EvaluatorThresholds evaluatorThresholds;
    private final RiskEngineConfig riskEngineConfig;

    public WaterRiskEvaluator(
            IndicatorJpaRepository indicatorJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            AnomalyJpaRepository anomalyJpaRepository,
            EvaluatorThresholds evaluatorThresholds,
            RiskEngineConfig riskEngineConfig,
            Clock clock) {
        super(indicatorJpaRepository, clock, riskEngineConfig.getRegionCode());
        this.observationJpaRepository = observationJpaRepository;
        this.anomalyJpaRepository = anomalyJpaRepository;
        this.evaluatorThresholds = evaluatorThresholds;
        this.riskEngineConfig = riskEngineConfig;
    }

    @Override
    public Domain domain() {
        return Domain.WATER;
    }

    @Override
    public Alert evaluate() {
        Optional<IndicatorEntity> indicator = indicator(GW_LEVEL);
        if (indicator.isEmpty()) {
            return stable();
        }
        Long indicatorId = indicator.get().getId();
        LocalDateTime since = now().minusHours(riskEngineConfig.getWaterLookbackHours());

        List<ObservationEntity> observations = read(
                GW_LEVEL,
                () -> observationJpaRepository.findSince(
                        indicatorId, since, PageRequest.of(0, riskEngineConfig.getMaxQueryLimit())));
        if (observations.isEmpty()) {
            return stable();
        }
        double averageLevel = observations.stream()
                .mapToDouble(ObservationEntity::getValue)
                .average()
                .orElse(Double.NaN);
        int stationCount = (int) observations.stream()
                .map(ObservationEntity::getStationId)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        long anomalyCount = read("GW_LEVEL anomalies", () -> anomalyJpaRepository.countUnacknowledged(indicatorId, since, 0.0));
        long criticalCount = read(
                "GW_LEVEL anomalies",
                () -> anomalyJpaRepository.countUnacknowledged(
                        indicatorId, since, evaluatorThresholds.getWater().getCriticalSeverity()));

        WaterPayload payload = WaterPayload.builder()
                .indicatorCode(GW_LEVEL)
                .anomalyCount(anomalyCount)
                .criticalAnomalyCount(criticalCount)
                .averageLevel(averageLevel)
                .observationCount(observations.size())
                .build();

        Optional<ThresholdTier> critical = evaluatorThresholds.waterCriticalAnomalyCascade().match(criticalCount);
        if (critical.isPresent()) {
            return newAlert(
                    critical.get().getLevel(),
                    critical.get().getCode(),
                    String.format("CRITICAL: %d aquifer anomalies detected", criticalCount),
                    payload);
        }
        Optional<ThresholdTier> tier = evaluatorThresholds.waterAnomalyCountCascade().match(anomalyCount);
        if (tier.isEmpty()) {
            return newAlert(
                    AlertLevel.NORMAL,
                    "WATR_NORMAL",
                    String.format("Groundwater levels normal (%d stations)", stationCount),
                    payload);
        }
        String message = tier.get().getLevel() == AlertLevel.WARNING
                ? String.format("WARNING: %d groundwater anomalies", anomalyCount)
                : String.format("WATCH: %d minor groundwater anomalies", anomalyCount);
        return newAlert(tier.get().getLevel(), tier.get().getCode(), message, payload);
    }

    private Alert stable() {
        return newAlert(
                AlertLevel.NORMAL,
                "WATR_NORMAL",
                "Groundwater levels stable",
                WaterPayload.builder().indicatorCode(GW_LEVEL).build());
    }
}
