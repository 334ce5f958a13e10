package com.linkedfate.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictivePayload implements AlertPayload {

    private String ruleCode;
    private String location;
    private String forecastIndicator;
    private double forecastValue;
    private double threshold;

    /** Label of the forecast horizon, e.g. "48h". */
    private String predictionWindow;

    private Double reserveMarginPct;

    @Override
    public String indicatorCode() {
        return forecastIndicator;
    }
}
