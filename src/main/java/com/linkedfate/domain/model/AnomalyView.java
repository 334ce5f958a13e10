package com.linkedfate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkedfate.domain.enums.AnomalyType;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Read model for the anomaly listing: the anomaly joined with its indicator and station.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnomalyView {

    private Long anomalyId;
    private String indicatorCode;
    private String indicatorName;
    private String stationName;
    private String stationExternalId;
    private LocalDateTime detectedAt;
    private AnomalyType anomalyType;
    private double severity;
    @JsonProperty("zScore")
    private double zscore;
    private double baselineValue;
    private double observedValue;
    private boolean acknowledged;
}
