package com.linkedfate.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grid evaluator context. {@code reserveMarginPct} and {@code generationMw} are null when no
 * generation reading was available and only demand was reported.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridPayload implements AlertPayload {

    private String indicatorCode;
    private Double demandMw;
    private Double generationMw;
    private Double reserveMarginPct;
    private Double threshold;

    @Override
    public String indicatorCode() {
        return indicatorCode;
    }
}
