package com.linkedfate.anomaly;

import com.linkedfate.domain.model.AnomalyView;
import com.linkedfate.entity.AnomalyEntity;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.StationEntity;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.repository.jpa.AnomalyJpaRepository;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the anomaly audit trail plus the one permitted mutation, acknowledgment.
 */
@Service
public class AnomalyQueryService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

    static final int MAX_LIMIT = 1000;

    private final AnomalyJpaRepository anomalyJpaRepository;
    private final IndicatorJpaRepository indicatorJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final Clock clock;

    public AnomalyQueryService(
            AnomalyJpaRepository anomalyJpaRepository,
            IndicatorJpaRepository indicatorJpaRepository,
            StationJpaRepository stationJpaRepository,
            Clock clock) {
        this.anomalyJpaRepository = anomalyJpaRepository;
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.clock = clock;
    }

    /**
     * Anomalies detected in the last {@code hours}, severity descending. An unknown indicator
     * code yields an empty list rather than an error.
     */
    @Transactional(readOnly = true)
    public List<AnomalyView> getRecentAnomalies(int hours, double minSeverity, String indicatorCode, int limit) {
        if (hours <= 0) {
            throw new ValidationException("hours must be positive");
        }
        if (minSeverity < 0 || minSeverity > 1) {
            throw new ValidationException("minSeverity must be within [0, 1]");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be within [1, " + MAX_LIMIT + "]");
        }

        Long indicatorId = null;
        if (indicatorCode != null && !indicatorCode.isBlank()) {
            Optional<IndicatorEntity> indicator = indicatorJpaRepository.findByCode(indicatorCode);
            if (indicator.isEmpty()) {
                return List.of();
            }
            indicatorId = indicator.get().getId();
        }

        LocalDateTime since = LocalDateTime.now(clock).minusHours(hours);
        List<AnomalyEntity> anomalies =
                anomalyJpaRepository.findRecent(since, minSeverity, indicatorId, PageRequest.of(0, limit));
        if (anomalies.isEmpty()) {
            return List.of();
        }

        Set<Long> indicatorIds = new HashSet<>();
        Set<Long> stationIds = new HashSet<>();
        for (AnomalyEntity anomaly : anomalies) {
            indicatorIds.add(anomaly.getIndicatorId());
            if (anomaly.getStationId() != null) {
                stationIds.add(anomaly.getStationId());
            }
        }
        Map<Long, IndicatorEntity> indicators = indicatorJpaRepository.findAllById(indicatorIds).stream()
                .collect(Collectors.toMap(IndicatorEntity::getId, Function.identity()));
        Map<Long, StationEntity> stations = stationJpaRepository.findAllById(stationIds).stream()
                .collect(Collectors.toMap(StationEntity::getId, Function.identity()));

        return anomalies.stream()
                .map(anomaly -> toView(
                        anomaly, indicators.get(anomaly.getIndicatorId()), stations.get(anomaly.getStationId())))
                .toList();
    }

    /** Idempotent: acknowledging an acknowledged anomaly leaves it unchanged. */
    @Transactional
    public AnomalyView acknowledge(Long anomalyId) {
        AnomalyEntity anomaly = anomalyJpaRepository
                .findById(anomalyId)
                .orElseThrow(() -> new ResourceNotFoundException("Anomaly", anomalyId));
        if (!anomaly.isAcknowledged()) {
            anomaly.setAcknowledged(true);
            anomalyJpaRepository.save(anomaly);
            log.info("Anomaly {} acknowledged", anomalyId);
        }
        IndicatorEntity indicator =
                indicatorJpaRepository.findById(anomaly.getIndicatorId()).orElse(null);
        StationEntity station = anomaly.getStationId() != null
                ? stationJpaRepository.findById(anomaly.getStationId()).orElse(null)
                : null;
        return toView(anomaly, indicator, station);
    }

    private AnomalyView toView(AnomalyEntity anomaly, IndicatorEntity indicator, StationEntity station) {
        return AnomalyView.builder()
                .anomalyId(anomaly.getId())
                .indicatorCode(indicator != null ? indicator.getCode() : null)
                .indicatorName(indicator != null ? indicator.getName() : null)
                .stationName(station != null ? station.getName() : null)
                .stationExternalId(station != null ? station.getExternalId() : null)
                .detectedAt(anomaly.getDetectedAt())
                .anomalyType(anomaly.getAnomalyType())
                .severity(anomaly.getSeverity())
                .zscore(anomaly.getZscore())
                .baselineValue(anomaly.getBaselineValue())
                .observedValue(anomaly.getObservedValue())
                .acknowledged(anomaly.isAcknowledged())
                .build();
    }
}
