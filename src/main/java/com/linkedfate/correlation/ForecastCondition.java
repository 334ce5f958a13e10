package com.linkedfate.correlation;

import com.linkedfate.domain.model.ForecastReading;
import com.linkedfate.evaluator.ThresholdCascade;
import com.linkedfate.evaluator.ThresholdTier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds for every location whose latest forecast of {@code indicatorCode} crosses the cascade.
 * The matched tier sets the contributed level.
 */
public class ForecastCondition implements RuleCondition {

    private final String indicatorCode;
    private final ThresholdCascade cascade;

    public ForecastCondition(String indicatorCode, ThresholdCascade cascade) {
        this.indicatorCode = indicatorCode;
        this.cascade = cascade;
    }

    @Override
    public List<Evidence> evaluate(CorrelationContext context) {
        List<Evidence> matches = new ArrayList<>();
        for (ForecastReading forecast : context.getSignals().forecasts(indicatorCode)) {
            Optional<ThresholdTier> tier = cascade.match(forecast.getValue());
            tier.ifPresent(t -> matches.add(Evidence.builder()
                    .kind(Evidence.Kind.FORECAST)
                    .forecast(forecast)
                    .level(t.getLevel())
                    .threshold(t.getCutoff())
                    .build()));
        }
        return matches;
    }
}
