package com.linkedfate.domain.payload;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.enums.MoveDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Context of a MARKET alert: the symbol move that coincided with a physical alert.
 * {@code sentimentScore} is only set for triple correlations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketPayload implements AlertPayload {

    private String ruleCode;
    private String symbol;
    private double changePercent;
    private MoveDirection direction;
    private String physicalDomain;

    /** Code of the most severe alert of the physical domain, e.g. GRID_STRAIN. */
    private String physicalAlert;

    private AlertLevel physicalLevel;
    private Confidence confidence;
    private Double sentimentScore;
}
