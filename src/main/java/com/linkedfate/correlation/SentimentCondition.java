package com.linkedfate.correlation;

import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.enums.Domain;
import java.util.List;
import java.util.Optional;

/**
 * Holds when the domain's aggregated news sentiment is below the negative threshold.
 * Confidence is STRONG at or below the very-negative threshold.
 */
public class SentimentCondition implements RuleCondition {

    private final Domain domain;
    private final double negative;
    private final double veryNegative;

    public SentimentCondition(Domain domain, double negative, double veryNegative) {
        this.domain = domain;
        this.negative = negative;
        this.veryNegative = veryNegative;
    }

    @Override
    public List<Evidence> evaluate(CorrelationContext context) {
        Optional<Double> score = context.getSignals().sentiment(domain);
        if (score.isEmpty() || Double.isNaN(score.get()) || score.get() >= negative) {
            return List.of();
        }
        return List.of(Evidence.builder()
                .kind(Evidence.Kind.SENTIMENT)
                .domain(domain)
                .sentimentScore(score.get())
                .confidence(score.get() <= veryNegative ? Confidence.STRONG : Confidence.MODERATE)
                .build());
    }
}
