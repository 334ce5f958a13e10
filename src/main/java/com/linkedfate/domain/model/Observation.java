package com.linkedfate.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A single timestamped reading for an indicator, optionally scoped to a station and/or region.
 *
 * <p>Observations are written by ingestors and are immutable once stored: the engine only
 * reads them. The natural key is (indicatorId, stationId, regionId, observedAt).
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Observation {

    private Long id;
    private Long indicatorId;
    private Long stationId;
    private Long regionId;
    private LocalDateTime observedAt;
    private double value;
    private String qualityFlag;
}
