package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One satisfying combination of evidence for a rule, one entry per condition in declaration
 * order. Accessors return the first evidence of a kind.
 */
public class RuleMatch {

    private final CorrelationRule rule;
    private final List<Evidence> evidence;

    public RuleMatch(CorrelationRule rule, List<Evidence> evidence) {
        this.rule = rule;
        this.evidence = List.copyOf(evidence);
    }

    public CorrelationRule getRule() {
        return rule;
    }

    public Optional<Evidence> first(Evidence.Kind kind) {
        return evidence.stream().filter(e -> e.getKind() == kind).findFirst();
    }

    public Evidence require(Evidence.Kind kind) {
        return first(kind).orElseThrow(() -> new IllegalStateException(
                "Rule " + rule.getCode() + " has no " + kind + " condition"));
    }

    /** Max level across all evidence that carries one. */
    public AlertLevel maxLevel() {
        return evidence.stream()
                .map(Evidence::getLevel)
                .filter(Objects::nonNull)
                .reduce(AlertLevel.NORMAL, AlertLevel::max);
    }

    /** Max level across the domain evidence. */
    public AlertLevel maxDomainLevel() {
        return evidence.stream()
                .filter(e -> e.getKind() == Evidence.Kind.DOMAIN)
                .map(Evidence::getLevel)
                .reduce(AlertLevel.NORMAL, AlertLevel::max);
    }

    /** Contributing domain code to its max severity, in condition order. */
    public Map<String, AlertLevel> domainLevels() {
        Map<String, AlertLevel> levels = new LinkedHashMap<>();
        for (Evidence e : evidence) {
            if (e.getKind() == Evidence.Kind.DOMAIN) {
                levels.put(e.getDomain().getCode(), e.getLevel());
            }
        }
        return levels;
    }
}
