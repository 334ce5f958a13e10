package com.linkedfate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkedfate.domain.enums.AnomalyType;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A flagged deviation of one observation from its indicator baseline.
 *
 * <p>Anomalies form an append-only audit trail owned by the anomaly detector. The only
 * mutation allowed after creation is flipping {@code acknowledged}. Deduplication key is
 * (indicatorId, stationId, regionId, detectedAt), where detectedAt is the observation time.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Anomaly {

    private Long id;
    private Long indicatorId;
    private Long stationId;
    private Long regionId;
    private LocalDateTime detectedAt;
    private AnomalyType anomalyType;

    /** 0..1, non-decreasing in |zScore|. */
    private double severity;

    private double baselineValue;
    private double observedValue;
    @JsonProperty("zScore")
    private double zscore;
    private boolean acknowledged;
    private LocalDateTime createdAt;
}
