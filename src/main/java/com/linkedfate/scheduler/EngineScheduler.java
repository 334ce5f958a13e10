package com.linkedfate.scheduler;

import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.alert.RiskEvaluationService;
import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.anomaly.AnomalyDetectionConfig;
import com.linkedfate.anomaly.AnomalyDetectionService;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.event.EventPublisherHelper;
import com.linkedfate.exception.CycleInProgressException;
import com.linkedfate.exception.CycleTimeoutException;
import com.linkedfate.exception.PersistenceFailureException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the two engine jobs on their cadence and guards every run, scheduled or manual.
 *
 * <ul>
 *   <li><b>No overlap:</b> a job that is still in flight rejects a new run with
 *       {@link CycleInProgressException}. The flag clears only when the worker thread is done,
 *       so a timed-out cycle that ignores interruption still blocks the next one.</li>
 *   <li><b>Timeout:</b> each run gets {@code linkedfate.risk.cycle-timeout-seconds} of wall time;
 *       past that the caller gets {@link CycleTimeoutException} and the worker is interrupted.
 *       A worker blocked in JDBC may not notice the interrupt and can still commit its cycle
 *       transaction later; the overlap guard holds until it does.</li>
 *   <li><b>Retry:</b> {@link PersistenceFailureException} is retried up to
 *       {@code max-retries} times through a resilience4j {@link Retry}, the delay doubling from
 *       {@code retry-delay-ms}. Other
 *       failures are not retried.</li>
 * </ul>
 *
 * <p>Every abandoned run publishes a {@code CycleFailedEvent}. The {@code @Scheduled} entry
 * points block until their cycle ends, so the task scheduler needs a thread per job
 * ({@code spring.task.scheduling.pool.size=2}) for one job not to delay the other.
 */
@Component
@EnableConfigurationProperties({AnomalyDetectionConfig.class, RiskEngineConfig.class})
public class EngineScheduler {

    private static final Logger log = LoggerFactory.getLogger(EngineScheduler.class);

    public static final String JOB_ANOMALY = "anomaly-detection";
    public static final String JOB_RISK = "risk-evaluation";

    private final AnomalyDetectionService anomalyDetectionService;
    private final RiskEvaluationService riskEvaluationService;
    private final AnomalyDetectionConfig anomalyDetectionConfig;
    private final RiskEngineConfig riskEngineConfig;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean anomalyInFlight = new AtomicBoolean(false);
    private final AtomicBoolean riskInFlight = new AtomicBoolean(false);

    private final ExecutorService anomalyExecutor = Executors.newSingleThreadExecutor(r -> worker(r, JOB_ANOMALY));
    private final ExecutorService riskExecutor = Executors.newSingleThreadExecutor(r -> worker(r, JOB_RISK));

    public EngineScheduler(
            AnomalyDetectionService anomalyDetectionService,
            RiskEvaluationService riskEvaluationService,
            AnomalyDetectionConfig anomalyDetectionConfig,
            RiskEngineConfig riskEngineConfig,
            EventPublisherHelper eventPublisherHelper) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.riskEvaluationService = riskEvaluationService;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
        this.riskEngineConfig = riskEngineConfig;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Scheduled(
            fixedDelayString = "${linkedfate.anomaly.interval-ms:3600000}",
            initialDelayString = "${linkedfate.anomaly.initial-delay-ms:60000}")
    public void scheduledAnomalyDetection() {
        if (!anomalyDetectionConfig.isEnabled()) {
            return;
        }
        try {
            triggerAnomalyDetection(anomalyDetectionConfig.getLookbackHours());
        } catch (CycleInProgressException e) {
            log.warn("Skipping scheduled anomaly detection: previous cycle still running");
        } catch (RuntimeException e) {
            log.error("Scheduled anomaly detection failed: {}", e.getMessage());
        }
    }

    @Scheduled(
            fixedDelayString = "${linkedfate.risk.interval-ms:300000}",
            initialDelayString = "${linkedfate.risk.initial-delay-ms:90000}")
    public void scheduledRiskEvaluation() {
        if (!riskEngineConfig.isEnabled()) {
            return;
        }
        try {
            triggerRiskEvaluation();
        } catch (CycleInProgressException e) {
            log.warn("Skipping scheduled risk evaluation: previous cycle still running");
        } catch (RuntimeException e) {
            log.error("Scheduled risk evaluation failed: {}", e.getMessage());
        }
    }

    public AnomalyDetectionSummary triggerAnomalyDetection(int lookbackHours) {
        return runGuarded(
                JOB_ANOMALY,
                anomalyInFlight,
                anomalyExecutor,
                () -> anomalyDetectionService.runAnomalyDetection(lookbackHours));
    }

    public RiskEvaluationSummary triggerRiskEvaluation() {
        return runGuarded(JOB_RISK, riskInFlight, riskExecutor, riskEvaluationService::runRiskEvaluation);
    }

    public boolean isRunning(String job) {
        return JOB_ANOMALY.equals(job) ? anomalyInFlight.get() : riskInFlight.get();
    }

    @PreDestroy
    public void shutdown() {
        anomalyExecutor.shutdownNow();
        riskExecutor.shutdownNow();
    }

    <T> T runGuarded(String job, AtomicBoolean inFlight, ExecutorService executor, Supplier<T> cycle) {
        if (!inFlight.compareAndSet(false, true)) {
            throw new CycleInProgressException(job);
        }
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean started = new AtomicBoolean(false);
        Future<T> future;
        try {
            future = executor.submit(() -> {
                started.set(true);
                try {
                    return withRetry(job, cycle, attempts);
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RuntimeException e) {
            inFlight.set(false);
            throw e;
        }

        long timeoutSeconds = riskEngineConfig.getCycleTimeoutSeconds();
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            cancel(future, started, inFlight);
            log.error("{} cycle exceeded {}s and was cancelled", job, timeoutSeconds);
            eventPublisherHelper.publishCycleFailed(this, job, "timeout", attempts.get());
            throw new CycleTimeoutException(job, timeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(future, started, inFlight);
            throw new IllegalStateException(job + " cycle interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            eventPublisherHelper.publishCycleFailed(this, job, cause.getMessage(), attempts.get());
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(job + " cycle failed", cause);
        }
    }

    private <T> T withRetry(String job, Supplier<T> cycle, AtomicInteger attempts) {
        int maxAttempts = riskEngineConfig.getMaxRetries() + 1;
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(riskEngineConfig.getRetryDelayMs(), 2.0))
                .retryExceptions(PersistenceFailureException.class)
                .build();
        Retry retry = Retry.of(job, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "{} cycle attempt {}/{} failed, retrying in {}ms: {}",
                        job,
                        event.getNumberOfRetryAttempts(),
                        maxAttempts,
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()))
                .onError(event -> log.error(
                        "{} cycle failed after {} attempts: {}",
                        job,
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));

        return Retry.decorateSupplier(retry, () -> {
                    attempts.incrementAndGet();
                    return cycle.get();
                })
                .get();
    }

    private static void cancel(Future<?> future, AtomicBoolean started, AtomicBoolean inFlight) {
        future.cancel(true);
        if (!started.get()) {
            inFlight.set(false);
        }
    }

    private static Thread worker(Runnable runnable, String job) {
        Thread thread = new Thread(runnable, "engine-" + job);
        thread.setDaemon(true);
        return thread;
    }
}
