package com.linkedfate.anomaly;

import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.model.Anomaly;
import com.linkedfate.domain.model.Indicator;
import com.linkedfate.event.EventPublisherHelper;
import com.linkedfate.exception.PersistenceFailureException;
import com.linkedfate.exception.UpstreamFetchException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.mapper.ReferenceDataMapper;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Runs one anomaly detection cycle across all indicators.
 *
 * <p>Detection is read-only and happens per indicator; a failed read for one indicator is
 * logged and skipped. All flagged anomalies are then written in a single transaction by
 * {@link AnomalyRecorder}, so a cycle either commits fully or not at all. Re-running over the
 * same window inserts nothing new.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final IndicatorJpaRepository indicatorJpaRepository;
    private final AnomalyDetector anomalyDetector;
    private final AnomalyRecorder anomalyRecorder;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReferenceDataMapper referenceDataMapper = Mappers.getMapper(ReferenceDataMapper.class);

    public AnomalyDetectionService(
            IndicatorJpaRepository indicatorJpaRepository,
            AnomalyDetector anomalyDetector,
            AnomalyRecorder anomalyRecorder,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.anomalyDetector = anomalyDetector;
        this.anomalyRecorder = anomalyRecorder;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Scores the last {@code lookbackHours} of every indicator against its baseline.
     *
     * @throws PersistenceFailureException if the write transaction fails; nothing was committed
     */
    public AnomalyDetectionSummary runAnomalyDetection(int lookbackHours) {
        if (lookbackHours <= 0) {
            throw new ValidationException("lookbackHours must be positive, got " + lookbackHours);
        }
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("cycleId", cycleId);
        long startNanos = System.nanoTime();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime lookbackStart = now.minusHours(lookbackHours);

            List<Indicator> indicators = loadIndicators();
            List<Anomaly> detected = new ArrayList<>();
            for (Indicator indicator : indicators) {
                try {
                    detected.addAll(anomalyDetector.detectForIndicator(indicator, lookbackStart));
                } catch (DataAccessException e) {
                    log.warn("Skipping indicator {} this cycle: {}", indicator.getCode(), e.getMessage());
                }
            }

            List<Anomaly> saved;
            try {
                saved = anomalyRecorder.saveNew(detected);
            } catch (DataAccessException | TransactionException e) {
                log.error("Anomaly cycle {} rolled back ({} detected)", cycleId, detected.size(), e);
                throw new PersistenceFailureException("Failed to persist anomalies", e);
            }

            Map<Long, String> codesById = new LinkedHashMap<>();
            indicators.forEach(indicator -> codesById.put(indicator.getId(), indicator.getCode()));
            Map<String, Integer> savedByIndicator = new LinkedHashMap<>();
            int critical = 0;
            for (Anomaly anomaly : saved) {
                savedByIndicator.merge(codesById.getOrDefault(anomaly.getIndicatorId(), "UNKNOWN"), 1, Integer::sum);
                if (anomaly.getAnomalyType() == AnomalyType.CRITICAL_DEVIATION) {
                    critical++;
                }
            }

            AnomalyDetectionSummary summary = AnomalyDetectionSummary.builder()
                    .cycleId(cycleId)
                    .evaluatedAt(now)
                    .lookbackHours(lookbackHours)
                    .indicatorsScanned(indicators.size())
                    .anomaliesDetected(detected.size())
                    .anomaliesSaved(saved.size())
                    .savedByIndicator(savedByIndicator)
                    .criticalCount(critical)
                    .significantCount(saved.size() - critical)
                    .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                    .build();

            log.info(
                    "Anomaly detection completed: {} indicators, {} detected, {} saved {}",
                    indicators.size(), detected.size(), saved.size(), savedByIndicator);
            eventPublisherHelper.publishAnomalyDetectionCompleted(this, summary);
            return summary;
        } finally {
            MDC.remove("cycleId");
        }
    }

    private List<Indicator> loadIndicators() {
        try {
            return referenceDataMapper.toIndicators(indicatorJpaRepository.findAll());
        } catch (DataAccessException e) {
            throw new UpstreamFetchException("indicators", e);
        }
    }
}
