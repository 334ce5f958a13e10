package com.linkedfate.observability;

import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.event.AnomalyDetectionCompletedEvent;
import com.linkedfate.event.CycleFailedEvent;
import com.linkedfate.event.RiskEvaluationCompletedEvent;
import com.linkedfate.scheduler.EngineScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the engine, fed by cycle events:
 * <ul>
 *   <li><b>linkedfate.anomalies.saved</b> (counter): anomalies inserted by detection cycles</li>
 *   <li><b>linkedfate.alerts.emitted</b> (counter, tag {@code level}): alerts persisted per level</li>
 *   <li><b>linkedfate.cycle.duration</b> (timer, tag {@code job}): wall time of completed cycles</li>
 *   <li><b>linkedfate.cycle.failures</b> (counter, tag {@code job}): abandoned cycles</li>
 * </ul>
 */
@Service
public class EngineMetricsService {

    private static final Logger log = LoggerFactory.getLogger(EngineMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter anomaliesSavedCounter;
    private final Map<AlertLevel, Counter> alertsEmittedCounters = new EnumMap<>(AlertLevel.class);
    private final Timer anomalyCycleTimer;
    private final Timer riskCycleTimer;

    public EngineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.anomaliesSavedCounter = Counter.builder("linkedfate.anomalies.saved")
                .description("Anomaly records inserted by detection cycles")
                .register(meterRegistry);

        for (AlertLevel level : AlertLevel.values()) {
            alertsEmittedCounters.put(
                    level,
                    Counter.builder("linkedfate.alerts.emitted")
                            .description("Alerts persisted by risk evaluation cycles")
                            .tag("level", level.name())
                            .register(meterRegistry));
        }

        this.anomalyCycleTimer = cycleTimer(EngineScheduler.JOB_ANOMALY);
        this.riskCycleTimer = cycleTimer(EngineScheduler.JOB_RISK);
    }

    @EventListener
    @Order(20)
    public void onAnomalyDetectionCompleted(AnomalyDetectionCompletedEvent event) {
        AnomalyDetectionSummary summary = event.getSummary();
        anomaliesSavedCounter.increment(summary.getAnomaliesSaved());
        anomalyCycleTimer.record(summary.getDurationMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onRiskEvaluationCompleted(RiskEvaluationCompletedEvent event) {
        RiskEvaluationSummary summary = event.getSummary();
        summary.getCountsByLevel().forEach((level, count) -> {
            if (count > 0) {
                alertsEmittedCounters.get(level).increment(count);
            }
        });
        riskCycleTimer.record(summary.getDurationMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onCycleFailed(CycleFailedEvent event) {
        Counter.builder("linkedfate.cycle.failures")
                .description("Cycles abandoned after retries, timeout or unexpected error")
                .tag("job", event.getJob())
                .register(meterRegistry)
                .increment();
        log.warn("Recorded {} cycle failure after {} attempt(s): {}", event.getJob(), event.getAttempts(), event.getReason());
    }

    private Timer cycleTimer(String job) {
        return Timer.builder("linkedfate.cycle.duration")
                .description("Wall time of completed engine cycles")
                .tag("job", job)
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);
    }
}
