package com.linkedfate.anomaly;

import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.enums.QualityFlag;
import com.linkedfate.domain.model.Anomaly;
import com.linkedfate.domain.model.Baseline;
import com.linkedfate.domain.model.Indicator;
import com.linkedfate.domain.model.Observation;
import com.linkedfate.mapper.ObservationMapper;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Flags recent observations of one indicator that deviate from their baseline.
 *
 * <p>Recent observations (the lookback window) are grouped by (station, region). Each group is
 * scored against a baseline computed over the window that ends where the lookback starts, so
 * the observations under test never contaminate their own reference. Groups without a usable
 * baseline are skipped.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final ObservationJpaRepository observationJpaRepository;
    private final BaselineCalculator baselineCalculator;
    private final AnomalyDetectionConfig anomalyDetectionConfig;
    private final Clock clock;

    private final ObservationMapper observationMapper = Mappers.getMapper(ObservationMapper.class);

    public AnomalyDetector(
            ObservationJpaRepository observationJpaRepository,
            BaselineCalculator baselineCalculator,
            AnomalyDetectionConfig anomalyDetectionConfig,
            Clock clock) {
        this.observationJpaRepository = observationJpaRepository;
        this.baselineCalculator = baselineCalculator;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
        this.clock = clock;
    }

    public List<Anomaly> detectForIndicator(Indicator indicator, LocalDateTime lookbackStart) {
        List<Observation> recent = observationMapper.toDomainList(observationJpaRepository.findRecent(
                indicator.getId(),
                QualityFlag.VALID.getCode(),
                lookbackStart,
                PageRequest.of(0, anomalyDetectionConfig.getMaxObservationsPerQuery())));
        if (recent.isEmpty()) {
            return List.of();
        }

        Map<List<Long>, List<Observation>> groups = new LinkedHashMap<>();
        for (Observation observation : recent) {
            groups.computeIfAbsent(
                            Arrays.asList(observation.getStationId(), observation.getRegionId()),
                            key -> new ArrayList<>())
                    .add(observation);
        }

        DeviationScorer scorer = DeviationScorer.from(anomalyDetectionConfig);
        LocalDateTime now = LocalDateTime.now(clock);
        List<Anomaly> anomalies = new ArrayList<>();

        for (Map.Entry<List<Long>, List<Observation>> group : groups.entrySet()) {
            Long stationId = group.getKey().get(0);
            Long regionId = group.getKey().get(1);
            Baseline baseline = baselineCalculator.computeBaseline(indicator.getId(), stationId, regionId, lookbackStart);
            if (!baseline.isSufficient()) {
                log.debug(
                        "Insufficient baseline for {} station={} region={} ({} samples)",
                        indicator.getCode(), stationId, regionId, baseline.getSampleCount());
                continue;
            }

            for (Observation observation : group.getValue()) {
                double zScore = scorer.zScore(observation.getValue(), baseline);
                AnomalyType type = scorer.classify(zScore);
                if (!type.isAnomalous()) {
                    continue;
                }
                anomalies.add(Anomaly.builder()
                        .indicatorId(indicator.getId())
                        .stationId(stationId)
                        .regionId(regionId)
                        .detectedAt(observation.getObservedAt())
                        .anomalyType(type)
                        .severity(scorer.severity(zScore))
                        .baselineValue(baseline.getMean())
                        .observedValue(observation.getValue())
                        .zscore(zScore)
                        .createdAt(now)
                        .build());
            }
        }

        log.debug("{}: {} observations in {} groups, {} flagged",
                indicator.getCode(), recent.size(), groups.size(), anomalies.size());
        return anomalies;
    }
}
