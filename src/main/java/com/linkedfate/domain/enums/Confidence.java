package com.linkedfate.domain.enums;

/**
 * Strength of a market or sentiment correlation, derived from the magnitude tier of the
 * contributing signal. Ordinal order is the strength order.
 */
public enum Confidence {
    WEAK,
    MODERATE,
    STRONG
}
