package com.linkedfate.anomaly;

import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.model.Baseline;

/**
 * Z-score arithmetic and classification against the configured sigma thresholds.
 *
 * <p>Pure and stateless apart from the thresholds; classification is symmetric in the sign of
 * the z-score.
 */
public class DeviationScorer {

    private final double thresholdSigma;
    private final double criticalSigma;
    private final double saturationSigma;

    public DeviationScorer(double thresholdSigma, double criticalSigma, double saturationSigma) {
        this.thresholdSigma = thresholdSigma;
        this.criticalSigma = criticalSigma;
        this.saturationSigma = saturationSigma;
    }

    public static DeviationScorer from(AnomalyDetectionConfig config) {
        return new DeviationScorer(config.getThresholdSigma(), config.getCriticalSigma(), config.getSaturationSigma());
    }

    /** Returns 0 when the stddev is zero or NaN, never NaN or infinity. */
    public double zScore(double value, double mean, double stddev) {
        if (stddev == 0 || Double.isNaN(stddev)) {
            return 0.0;
        }
        return (value - mean) / stddev;
    }

    public double zScore(double value, Baseline baseline) {
        return zScore(value, baseline.getMean(), baseline.getStddev());
    }

    public AnomalyType classify(double zScore) {
        double absZ = Math.abs(zScore);
        if (absZ >= criticalSigma) {
            return AnomalyType.CRITICAL_DEVIATION;
        }
        if (absZ >= thresholdSigma) {
            return AnomalyType.SIGNIFICANT_DEVIATION;
        }
        return AnomalyType.NONE;
    }

    /**
     * Maps |z| onto [0, 1]: 0 below the threshold, 0.5 at the threshold, rising linearly to 1.0
     * at the saturation sigma and flat above it.
     */
    public double severity(double zScore) {
        double absZ = Math.abs(zScore);
        if (Double.isNaN(absZ) || absZ < thresholdSigma) {
            return 0.0;
        }
        if (absZ >= saturationSigma) {
            return 1.0;
        }
        return Math.min(1.0, 0.5 + 0.5 * (absZ - thresholdSigma) / (saturationSigma - thresholdSigma));
    }
}
