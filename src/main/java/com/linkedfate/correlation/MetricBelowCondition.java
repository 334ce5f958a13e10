package com.linkedfate.correlation;

import java.util.List;
import java.util.Optional;

/** Holds when a derived metric (e.g. grid reserve margin) is present and below the cutoff. */
public class MetricBelowCondition implements RuleCondition {

    private final String metricName;
    private final double cutoff;

    public MetricBelowCondition(String metricName, double cutoff) {
        this.metricName = metricName;
        this.cutoff = cutoff;
    }

    @Override
    public List<Evidence> evaluate(CorrelationContext context) {
        Optional<Double> value = context.getSignals().metric(metricName);
        if (value.isEmpty() || Double.isNaN(value.get()) || value.get() >= cutoff) {
            return List.of();
        }
        return List.of(Evidence.builder()
                .kind(Evidence.Kind.METRIC)
                .metricName(metricName)
                .metricValue(value.get())
                .threshold(cutoff)
                .build());
    }
}
