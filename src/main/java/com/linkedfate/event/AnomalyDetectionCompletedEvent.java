package com.linkedfate.event;

import com.linkedfate.anomaly.AnomalyDetectionSummary;
import org.springframework.context.ApplicationEvent;

/** Published after an anomaly detection cycle has committed its anomalies. */
public class AnomalyDetectionCompletedEvent extends ApplicationEvent {

    private final AnomalyDetectionSummary summary;

    public AnomalyDetectionCompletedEvent(Object source, AnomalyDetectionSummary summary) {
        super(source);
        this.summary = summary;
    }

    public AnomalyDetectionSummary getSummary() {
        return summary;
    }
}
