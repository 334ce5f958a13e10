package com.linkedfate.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a z-score against the configured sigma thresholds.
 *
 * <p>NONE is never persisted: an anomaly record exists only for the two deviation types.
 */
public enum AnomalyType {
    NONE("none"),
    SIGNIFICANT_DEVIATION("significant_deviation"),
    CRITICAL_DEVIATION("critical_deviation");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAnomalous() {
        return this != NONE;
    }
}
