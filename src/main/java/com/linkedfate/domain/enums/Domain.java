package com.linkedfate.domain.enums;

/**
 * Physical domains evaluated by the threshold evaluators.
 *
 * <p>The short code is the function code used by indicators and by the alert type column
 * (GRID, WATR, FLOW).
 */
public enum Domain {
    GRID("GRID", AlertType.GRID),
    WATER("WATR", AlertType.WATR),
    PORT("FLOW", AlertType.FLOW);

    private final String code;
    private final AlertType alertType;

    Domain(String code, AlertType alertType) {
        this.code = code;
        this.alertType = alertType;
    }

    public String getCode() {
        return code;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public static Domain fromCode(String code) {
        for (Domain domain : values()) {
            if (domain.code.equalsIgnoreCase(code) || domain.name().equalsIgnoreCase(code)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown domain code: " + code);
    }
}
