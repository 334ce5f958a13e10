package com.linkedfate.event;

import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.domain.model.Alert;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a risk evaluation cycle has committed its alerts.
 *
 * <p>Carries the ordered alert list as persisted (linked composites first). Listeners must
 * treat it as read-only.
 */
public class RiskEvaluationCompletedEvent extends ApplicationEvent {

    private final RiskEvaluationSummary summary;
    private final List<Alert> alerts;

    public RiskEvaluationCompletedEvent(Object source, RiskEvaluationSummary summary, List<Alert> alerts) {
        super(source);
        this.summary = summary;
        this.alerts = alerts != null ? List.copyOf(alerts) : List.of();
    }

    public RiskEvaluationSummary getSummary() {
        return summary;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }
}
