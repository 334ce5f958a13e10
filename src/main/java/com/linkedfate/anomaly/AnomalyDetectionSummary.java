package com.linkedfate.anomaly;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** Result of one anomaly detection cycle, returned to the scheduler and the engine API. */
@Getter
@Builder
@AllArgsConstructor
public class AnomalyDetectionSummary {

    private final String cycleId;
    private final LocalDateTime evaluatedAt;
    private final int lookbackHours;
    private final int indicatorsScanned;
    private final int anomaliesDetected;
    private final int anomaliesSaved;

    /** Saved anomalies per indicator code; indicators with none are omitted. */
    private final Map<String, Integer> savedByIndicator;

    private final int criticalCount;
    private final int significantCount;
    private final long durationMs;
}
