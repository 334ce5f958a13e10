package com.linkedfate.evaluator;

import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;

/**
 * Turns the current state of one physical domain into exactly one alert.
 *
 * <p>Implementations return a NORMAL alert when nothing is abnormal or when the domain has no
 * data yet. A read failure is signalled with {@link com.linkedfate.exception.UpstreamFetchException};
 * the caller isolates it from the other domains.
 */
public interface DomainEvaluator {

    Domain domain();

    Alert evaluate();
}
