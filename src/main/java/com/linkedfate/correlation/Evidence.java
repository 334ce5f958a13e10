package com.linkedfate.correlation;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.ForecastReading;
import com.linkedfate.domain.model.MarketMove;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What one rule condition matched on. Only the fields of the condition's kind are set.
 */
@Getter
@Builder
@ToString
public class Evidence {

    public enum Kind {
        DOMAIN,
        MARKET,
        SENTIMENT,
        FORECAST,
        METRIC
    }

    private final Kind kind;

    /** Level the condition contributes: the domain's max severity or the forecast tier level. */
    private final AlertLevel level;

    private final Confidence confidence;

    private final Domain domain;
    private final String alertCode;

    private final MarketMove move;
    private final Double sentimentScore;

    private final ForecastReading forecast;
    private final Double threshold;

    private final String metricName;
    private final Double metricValue;
}
