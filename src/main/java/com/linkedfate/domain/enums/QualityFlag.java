package com.linkedfate.domain.enums;

/**
 * Quality flag written by ingestors alongside each observation.
 * Only {@link #VALID} observations feed baselines and anomaly detection.
 */
public enum QualityFlag {
    VALID("valid"),
    ESTIMATED("estimated"),
    SUSPECT("suspect"),
    INVALID("invalid"),
    SIMULATED("simulated");

    private final String code;

    QualityFlag(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static QualityFlag fromCode(String code) {
        if (code == null || code.isBlank()) {
            return VALID;
        }
        for (QualityFlag flag : values()) {
            if (flag.code.equalsIgnoreCase(code)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown quality flag: " + code);
    }
}
