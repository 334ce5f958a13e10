package com.linkedfate.correlation;

import java.util.List;

/**
 * One conjunct of a correlation rule.
 *
 * <p>Returns every piece of evidence that satisfies the condition in the given context, or an
 * empty list when it does not hold. Several results (e.g. two watchlist symbols moving) make
 * the rule fan out into one alert per combination.
 */
@FunctionalInterface
public interface RuleCondition {

    List<Evidence> evaluate(CorrelationContext context);
}
