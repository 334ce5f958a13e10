package com.linkedfate.anomaly;

import com.linkedfate.domain.enums.QualityFlag;
import com.linkedfate.domain.model.Baseline;
import com.linkedfate.repository.jpa.BaselineAggregate;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import java.time.LocalDateTime;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Computes the trailing baseline of an indicator over {@code [endTime - window, endTime)}.
 *
 * <p>The database aggregates in two passes, the mean first and then the squared deviations
 * from it, so the window size does not affect how many rows are transferred and a flat series
 * comes out with zero spread. Only valid-quality observations count.
 */
@Component
@EnableConfigurationProperties(AnomalyDetectionConfig.class)
public class BaselineCalculator {

    private final ObservationJpaRepository observationJpaRepository;
    private final AnomalyDetectionConfig anomalyDetectionConfig;

    public BaselineCalculator(
            ObservationJpaRepository observationJpaRepository, AnomalyDetectionConfig anomalyDetectionConfig) {
        this.observationJpaRepository = observationJpaRepository;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
    }

    /**
     * A null station or region id leaves that dimension unfiltered. Returns
     * {@link Baseline#EMPTY} when nothing matches.
     */
    public Baseline computeBaseline(Long indicatorId, Long stationId, Long regionId, LocalDateTime endTime) {
        LocalDateTime start = endTime.minusDays(anomalyDetectionConfig.getBaselineWindowDays());
        String qualityFlag = QualityFlag.VALID.getCode();
        BaselineAggregate aggregate =
                observationJpaRepository.aggregate(indicatorId, stationId, regionId, qualityFlag, start, endTime);
        if (aggregate == null || aggregate.getCount() == 0) {
            return Baseline.EMPTY;
        }
        if (aggregate.getCount() < 2) {
            return Baseline.of(aggregate.getCount(), aggregate.getMean(), 0.0);
        }
        Double squaredDeviations = observationJpaRepository.sumOfSquaredDeviations(
                indicatorId, stationId, regionId, qualityFlag, start, endTime, aggregate.getMean());
        return Baseline.of(
                aggregate.getCount(), aggregate.getMean(), squaredDeviations != null ? squaredDeviations : 0.0);
    }
}
