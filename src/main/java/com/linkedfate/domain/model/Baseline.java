package com.linkedfate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Mean and sample standard deviation of an indicator over a trailing window.
 *
 * <p>Derived on demand and never persisted. A zero (or NaN) standard deviation means there is
 * not enough history to score against; callers must check {@link #isSufficient()} and never
 * divide by the stddev themselves.
 */
@Getter
@ToString
@AllArgsConstructor
public class Baseline {

    public static final Baseline EMPTY = new Baseline(0.0, 0.0, 0);

    private static final double FLAT_TOLERANCE = 1e-9;

    private final double mean;
    private final double stddev;
    private final long sampleCount;

    public boolean isSufficient() {
        return stddev > 0 && !Double.isNaN(stddev);
    }

    /**
     * Builds a baseline from the sample count, the mean and the sum of squared deviations from
     * that mean. Returns {@link #EMPTY} when the window is empty. Fewer than two samples, or a
     * spread indistinguishable from rounding error relative to the mean, yield a zero stddev.
     */
    public static Baseline of(long count, double mean, double sumOfSquaredDeviations) {
        if (count <= 0) {
            return EMPTY;
        }
        if (count < 2) {
            return new Baseline(mean, 0.0, count);
        }
        double stddev = Math.sqrt(Math.max(0.0, sumOfSquaredDeviations) / (count - 1));
        if (stddev <= FLAT_TOLERANCE * Math.max(1.0, Math.abs(mean))) {
            stddev = 0.0;
        }
        return new Baseline(mean, stddev, count);
    }
}
