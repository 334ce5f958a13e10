package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Input of one correlation pass: the per-domain alerts of the cycle, reduced to their max
 * severity, plus the non-physical signals. A domain without alerts counts as NORMAL.
 */
public class CorrelationContext {

    private final Map<Domain, Alert> mostSevere = new EnumMap<>(Domain.class);
    private final CorrelationSignals signals;

    public CorrelationContext(Collection<Alert> domainAlerts, CorrelationSignals signals) {
        for (Alert alert : domainAlerts) {
            Domain domain = domainOf(alert);
            if (domain == null || alert.getAlertLevel() == null) {
                continue;
            }
            mostSevere.merge(domain, alert, (a, b) -> b.getAlertLevel().compareTo(a.getAlertLevel()) > 0 ? b : a);
        }
        this.signals = signals != null ? signals : CorrelationSignals.empty();
    }

    public AlertLevel maxSeverity(Domain domain) {
        Alert alert = mostSevere.get(domain);
        return alert != null ? alert.getAlertLevel() : AlertLevel.NORMAL;
    }

    public Optional<Alert> mostSevereAlert(Domain domain) {
        return Optional.ofNullable(mostSevere.get(domain));
    }

    public CorrelationSignals getSignals() {
        return signals;
    }

    /** Domain levels in declaration order, for logging. */
    public Map<Domain, AlertLevel> domainLevels() {
        Map<Domain, AlertLevel> levels = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            levels.put(domain, maxSeverity(domain));
        }
        return levels;
    }

    private static Domain domainOf(Alert alert) {
        for (Domain domain : Domain.values()) {
            if (domain.getAlertType() == alert.getAlertType()) {
                return domain;
            }
        }
        return null;
    }
}
