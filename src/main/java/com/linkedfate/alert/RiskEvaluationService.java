package com.linkedfate.alert;

import com.linkedfate.correlation.LinkedFateEngine;
import com.linkedfate.correlation.SignalSnapshotReader;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import com.linkedfate.domain.payload.DegradedPayload;
import com.linkedfate.evaluator.DomainEvaluator;
import com.linkedfate.event.EventPublisherHelper;
import com.linkedfate.exception.PersistenceFailureException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Runs one risk evaluation cycle: domain evaluators, Linked Fate correlation, then a single
 * transactional write to the {@link AlertStore}.
 *
 * <p>Failure isolation:
 * <ul>
 *   <li>An evaluator that throws yields a NORMAL {@code <DOMAIN>_UNAVAILABLE} alert; the other
 *       domains still run.</li>
 *   <li>A correlation failure drops only the composite alerts of the cycle.</li>
 *   <li>A write failure rolls back the whole cycle and surfaces as
 *       {@link PersistenceFailureException} for the scheduler to retry.</li>
 * </ul>
 */
@Service
@EnableConfigurationProperties(RiskEngineConfig.class)
public class RiskEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(RiskEvaluationService.class);

    private final List<DomainEvaluator> evaluators;
    private final SignalSnapshotReader signalSnapshotReader;
    private final LinkedFateEngine linkedFateEngine;
    private final AlertStore alertStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final RiskEngineConfig riskEngineConfig;
    private final Clock clock;

    public RiskEvaluationService(
            List<DomainEvaluator> evaluators,
            SignalSnapshotReader signalSnapshotReader,
            LinkedFateEngine linkedFateEngine,
            AlertStore alertStore,
            EventPublisherHelper eventPublisherHelper,
            RiskEngineConfig riskEngineConfig,
            Clock clock) {
        this.evaluators = evaluators.stream()
                .sorted(Comparator.comparing(DomainEvaluator::domain))
                .toList();
        this.signalSnapshotReader = signalSnapshotReader;
        this.linkedFateEngine = linkedFateEngine;
        this.alertStore = alertStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.riskEngineConfig = riskEngineConfig;
        this.clock = clock;
    }

    /**
     * @throws PersistenceFailureException if the cycle's alerts could not be committed
     */
    public RiskEvaluationSummary runRiskEvaluation() {
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("cycleId", cycleId);
        long startNanos = System.nanoTime();
        try {
            List<Alert> domainAlerts = new ArrayList<>();
            List<String> degraded = new ArrayList<>();
            for (DomainEvaluator evaluator : evaluators) {
                Domain domain = evaluator.domain();
                MDC.put("domain", domain.getCode());
                try {
                    domainAlerts.add(evaluator.evaluate());
                } catch (RuntimeException e) {
                    log.warn("Domain {} unavailable this cycle: {}", domain.getCode(), e.getMessage(), e);
                    degraded.add(domain.getCode());
                    domainAlerts.add(unavailable(domain, e));
                } finally {
                    MDC.remove("domain");
                }
            }

            List<Alert> linked;
            boolean correlationFailed = false;
            try {
                CorrelationSignals signals = signalSnapshotReader.read(domainAlerts);
                linked = linkedFateEngine.evaluate(domainAlerts, signals);
            } catch (RuntimeException e) {
                log.error("Correlation failed, emitting domain alerts only", e);
                linked = List.of();
                correlationFailed = true;
            }

            List<Alert> ordered = order(linked, domainAlerts);
            AlertStore.PersistedCycle persisted;
            try {
                persisted = alertStore.persistCycle(ordered);
            } catch (DataAccessException | TransactionException e) {
                log.error("Risk cycle {} rolled back ({} alerts)", cycleId, ordered.size(), e);
                throw new PersistenceFailureException("Failed to persist alerts", e);
            }

            RiskEvaluationSummary summary = summarize(
                    cycleId, persisted, linked.size(), degraded, correlationFailed, startNanos);
            log.info(
                    "Risk evaluation completed: {} alerts {} by type {}, {} linked, degraded {}",
                    summary.getTotalAlerts(),
                    summary.getCountsByLevel(),
                    summary.getCountsByDomain(),
                    summary.getLinkedCount(),
                    degraded);
            eventPublisherHelper.publishRiskEvaluationCompleted(this, summary, persisted.getAlerts());
            return summary;
        } finally {
            MDC.remove("cycleId");
        }
    }

    /** Composites first, then domain alerts, each by severity then recency. */
    static List<Alert> order(List<Alert> linked, List<Alert> domainAlerts) {
        List<Alert> ordered = new ArrayList<>(linked.size() + domainAlerts.size());
        linked.stream().sorted(Alert.SEVERITY_THEN_RECENCY).forEach(ordered::add);
        domainAlerts.stream().sorted(Alert.SEVERITY_THEN_RECENCY).forEach(ordered::add);
        return ordered;
    }

    private Alert unavailable(Domain domain, RuntimeException cause) {
        String code = domain.getCode() + "_UNAVAILABLE";
        return Alert.builder()
                .alertType(domain.getAlertType())
                .alertLevel(AlertLevel.NORMAL)
                .code(code)
                .title(Alert.titleFromCode(code))
                .message(domain.getCode() + " data temporarily unavailable")
                .payload(DegradedPayload.builder()
                        .domain(domain.getCode())
                        .reason(cause.getMessage())
                        .build())
                .regionCode(riskEngineConfig.getRegionCode())
                .triggeredAt(LocalDateTime.now(clock))
                .build();
    }

    private RiskEvaluationSummary summarize(
            String cycleId,
            AlertStore.PersistedCycle persisted,
            int linkedCount,
            List<String> degraded,
            boolean correlationFailed,
            long startNanos) {
        Map<AlertLevel, Integer> byLevel = new EnumMap<>(AlertLevel.class);
        for (AlertLevel level : AlertLevel.values()) {
            byLevel.put(level, 0);
        }
        Map<String, Integer> byDomain = new LinkedHashMap<>();
        for (Alert alert : persisted.getAlerts()) {
            byLevel.merge(alert.getAlertLevel(), 1, Integer::sum);
            byDomain.merge(alert.getAlertType().name(), 1, Integer::sum);
        }
        return RiskEvaluationSummary.builder()
                .cycleId(cycleId)
                .evaluatedAt(LocalDateTime.now(clock))
                .totalAlerts(persisted.getAlerts().size())
                .countsByLevel(byLevel)
                .countsByDomain(byDomain)
                .linkedCount(linkedCount)
                .deactivatedCount(persisted.getDeactivated())
                .degradedDomains(List.copyOf(degraded))
                .correlationFailed(correlationFailed)
                .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                .build();
    }
}
