package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.AlertPayload;
import java.util.List;
import java.util.function.Function;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Declarative correlation rule: a conjunction of conditions and the alert template emitted
 * for every satisfying combination of evidence.
 *
 * <p>An {@code overriding} rule that fires suppresses the later rules of its {@code group} for
 * that cycle. Rules outside the group still run.
 */
@Getter
@Builder
public class CorrelationRule {

    private final String code;
    private final AlertType alertType;

    @Singular
    private final List<RuleCondition> conditions;

    /** Rules sharing a group can be suppressed together by an overriding member; null for none. */
    private final String group;

    private final boolean overriding;

    /** Level of the emitted alert. Defaults to the highest level any evidence contributes. */
    @Builder.Default
    private final Function<RuleMatch, AlertLevel> level = RuleMatch::maxLevel;

    /** Null for rules that carry no confidence. */
    private final Function<RuleMatch, Confidence> confidence;

    /** Defaults to the title derived from the code. */
    private final Function<RuleMatch, String> title;

    private final Function<RuleMatch, String> message;
    private final Function<RuleMatch, AlertPayload> payload;

    /** Label such as "48h" for predictive rules, null otherwise. */
    private final String predictionWindow;

    public String titleFor(RuleMatch match) {
        return title != null ? title.apply(match) : Alert.titleFromCode(code);
    }

    public Confidence confidenceFor(RuleMatch match) {
        return confidence != null ? confidence.apply(match) : null;
    }
}
