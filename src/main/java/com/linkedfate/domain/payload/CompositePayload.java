package com.linkedfate.domain.payload;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Confidence;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Context of a LINKED alert: the rule that fired and the max severity of each contributing
 * domain (keyed by domain code). Sentiment-backed rules also carry the score and confidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositePayload implements AlertPayload {

    private String ruleCode;
    private Map<String, AlertLevel> domainLevels;
    private Double sentimentScore;
    private Confidence confidence;
}
