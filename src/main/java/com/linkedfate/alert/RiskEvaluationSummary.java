package com.linkedfate.alert;

import com.linkedfate.domain.enums.AlertLevel;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** Result of one risk evaluation cycle, returned to the scheduler and the engine API. */
@Getter
@Builder
@AllArgsConstructor
public class RiskEvaluationSummary {

    private final String cycleId;
    private final LocalDateTime evaluatedAt;
    private final int totalAlerts;

    /** Every level is present, zero when no alert of that level was emitted. */
    private final Map<AlertLevel, Integer> countsByLevel;

    /** Alert type (GRID, WATR, FLOW, LINKED, MARKET, PREDICTIVE) to count. */
    private final Map<String, Integer> countsByDomain;

    private final int linkedCount;
    private final int deactivatedCount;

    /** Domain codes whose evaluator failed and reported as unavailable. */
    private final List<String> degradedDomains;

    private final boolean correlationFailed;
    private final long durationMs;
}
