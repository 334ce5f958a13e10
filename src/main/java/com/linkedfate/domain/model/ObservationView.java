package com.linkedfate.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Read model for the observation listing: the reading with its indicator unit and station.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationView {

    private Long observationId;
    private String indicatorCode;
    private String stationExternalId;
    private String stationName;
    private double value;
    private String unit;
    private LocalDateTime observedAt;
    private String qualityFlag;
}
