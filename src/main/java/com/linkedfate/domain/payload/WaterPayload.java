package com.linkedfate.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaterPayload implements AlertPayload {

    private String indicatorCode;
    private long anomalyCount;
    private long criticalAnomalyCount;
    private Double averageLevel;
    private int observationCount;

    @Override
    public String indicatorCode() {
        return indicatorCode;
    }
}
