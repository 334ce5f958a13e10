package com.linkedfate.domain.enums;

/**
 * Severity level shared by every alert the engine emits.
 *
 * <p>Declaration order is the severity order: {@code NORMAL < WATCH < WARNING < CRITICAL}.
 * All comparisons, "max severity per domain" reductions and result sorting go through
 * this ordering, so new levels must be inserted at the right position.
 */
public enum AlertLevel {

    /** Within expected parameters. */
    NORMAL,

    /** Approaching a threshold. */
    WATCH,

    /** Threshold breached. */
    WARNING,

    /** Multiple thresholds breached or cascading risk. */
    CRITICAL;

    public boolean isAtLeast(AlertLevel other) {
        return compareTo(other) >= 0;
    }

    public static AlertLevel max(AlertLevel a, AlertLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
