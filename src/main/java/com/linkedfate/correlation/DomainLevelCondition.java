package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import java.util.List;

/** Holds when the domain's max severity this cycle is at least {@code minLevel}. */
public class DomainLevelCondition implements RuleCondition {

    private final Domain domain;
    private final AlertLevel minLevel;

    public DomainLevelCondition(Domain domain, AlertLevel minLevel) {
        this.domain = domain;
        this.minLevel = minLevel;
    }

    @Override
    public List<Evidence> evaluate(CorrelationContext context) {
        AlertLevel level = context.maxSeverity(domain);
        if (!level.isAtLeast(minLevel)) {
            return List.of();
        }
        return List.of(Evidence.builder()
                .kind(Evidence.Kind.DOMAIN)
                .domain(domain)
                .level(level)
                .alertCode(context.mostSevereAlert(domain).map(Alert::getCode).orElse(null))
                .build());
    }

    public Domain getDomain() {
        return domain;
    }
}
