package com.linkedfate.correlation;

import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Evaluates the {@link LinkedFateRuleTable} against one cycle's domain alerts and signals.
 *
 * <p>Rules run in table order. A rule fires once per combination of its conditions'
 * evidence (cartesian product), so a market rule with two moving symbols emits two alerts.
 * When an overriding rule fires, the later rules of its group are skipped for the cycle; other
 * groups are unaffected.
 *
 * <p>Stateless; the returned alerts are not persisted here.
 */
@Component
@EnableConfigurationProperties(RiskEngineConfig.class)
public class LinkedFateEngine {

    private static final Logger log = LoggerFactory.getLogger(LinkedFateEngine.class);

    private final LinkedFateRuleTable ruleTable;
    private final RiskEngineConfig riskEngineConfig;
    private final Clock clock;

    public LinkedFateEngine(LinkedFateRuleTable ruleTable, RiskEngineConfig riskEngineConfig, Clock clock) {
        this.ruleTable = ruleTable;
        this.riskEngineConfig = riskEngineConfig;
        this.clock = clock;
    }

    public List<Alert> evaluate(Collection<Alert> domainAlerts, CorrelationSignals signals) {
        CorrelationContext context = new CorrelationContext(domainAlerts, signals);
        log.debug("Correlating domain levels {}", context.domainLevels());

        LocalDateTime now = LocalDateTime.now(clock);
        List<Alert> linked = new ArrayList<>();
        Set<String> suppressedGroups = new HashSet<>();
        for (CorrelationRule rule : ruleTable.rules()) {
            if (rule.getGroup() != null && suppressedGroups.contains(rule.getGroup())) {
                log.debug("Rule {} suppressed by an overriding rule in group {}", rule.getCode(), rule.getGroup());
                continue;
            }
            List<RuleMatch> matches = matches(rule, context);
            if (matches.isEmpty()) {
                continue;
            }
            List<Alert> fired = new ArrayList<>(matches.size());
            for (RuleMatch match : matches) {
                fired.add(toAlert(rule, match, now));
            }
            for (Alert alert : fired) {
                log.warn("Linked rule {} fired at {}: {}", rule.getCode(), alert.getAlertLevel(), alert.getMessage());
            }
            linked.addAll(fired);
            if (rule.isOverriding() && rule.getGroup() != null) {
                log.warn("Rule {} overrides the remaining {} rules this cycle", rule.getCode(), rule.getGroup());
                suppressedGroups.add(rule.getGroup());
            }
        }
        return linked;
    }

    /** Cartesian product of each condition's evidence; empty as soon as one condition has none. */
    List<RuleMatch> matches(CorrelationRule rule, CorrelationContext context) {
        List<List<Evidence>> combinations = new ArrayList<>();
        combinations.add(List.of());
        for (RuleCondition condition : rule.getConditions()) {
            List<Evidence> evidence = condition.evaluate(context);
            if (evidence.isEmpty()) {
                return List.of();
            }
            List<List<Evidence>> extended = new ArrayList<>(combinations.size() * evidence.size());
            for (List<Evidence> prefix : combinations) {
                for (Evidence e : evidence) {
                    List<Evidence> next = new ArrayList<>(prefix);
                    next.add(e);
                    extended.add(next);
                }
            }
            combinations = extended;
        }
        List<RuleMatch> matches = new ArrayList<>(combinations.size());
        for (List<Evidence> combination : combinations) {
            matches.add(new RuleMatch(rule, combination));
        }
        return matches;
    }

    private Alert toAlert(CorrelationRule rule, RuleMatch match, LocalDateTime now) {
        AlertLevel level = rule.getLevel().apply(match);
        return Alert.builder()
                .alertType(rule.getAlertType())
                .alertLevel(level)
                .code(rule.getCode())
                .title(rule.titleFor(match))
                .message(rule.getMessage().apply(match))
                .payload(rule.getPayload() != null ? rule.getPayload().apply(match) : null)
                .regionCode(riskEngineConfig.getRegionCode())
                .triggeredAt(now)
                .build();
    }
}
