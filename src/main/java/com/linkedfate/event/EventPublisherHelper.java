package com.linkedfate.event;

import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.domain.model.Alert;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for the engine's
 * cycle events. Listeners run synchronously on the publishing thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Anomaly detection ----

    public void publishAnomalyDetectionCompleted(Object source, AnomalyDetectionSummary summary) {
        applicationEventPublisher.publishEvent(new AnomalyDetectionCompletedEvent(source, summary));
    }

    // ---- Risk evaluation ----

    public void publishRiskEvaluationCompleted(Object source, RiskEvaluationSummary summary, List<Alert> alerts) {
        applicationEventPublisher.publishEvent(new RiskEvaluationCompletedEvent(source, summary, alerts));
    }

    // ---- Scheduler ----

    public void publishCycleFailed(Object source, String job, String reason, int attempts) {
        applicationEventPublisher.publishEvent(new CycleFailedEvent(source, job, reason, attempts));
    }
}
