package com.linkedfate.evaluator;

import com.linkedfate.domain.enums.AlertLevel;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Domain threshold values under the {@code linkedfate.thresholds} prefix.
 *
 * <p>The cascades are built from these values; {@link #validate()} builds each once so an
 * unordered configuration fails at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "linkedfate.thresholds")
public class EvaluatorThresholds {

    private Grid grid = new Grid();
    private Water water = new Water();
    private Port port = new Port();

    @PostConstruct
    public void validate() {
        gridReserveMarginCascade();
        waterAnomalyCountCascade();
        waterCriticalAnomalyCascade();
        portWaitingCascade();
        portDwellCascade();
        if (water.criticalSeverity <= 0 || water.criticalSeverity > 1) {
            throw new IllegalStateException("Water critical severity must be within (0, 1]");
        }
    }

    public ThresholdCascade gridReserveMarginCascade() {
        return ThresholdCascade.below(
                new ThresholdTier(AlertLevel.CRITICAL, "GRID_EMERGENCY", grid.reserveMarginCritical),
                new ThresholdTier(AlertLevel.WARNING, "GRID_STRAIN", grid.reserveMarginWarning),
                new ThresholdTier(AlertLevel.WATCH, "GRID_MARGIN_LOW", grid.reserveMarginWatch));
    }

    public ThresholdCascade waterCriticalAnomalyCascade() {
        return ThresholdCascade.above(new ThresholdTier(AlertLevel.CRITICAL, "AQUIFER_CRITICAL", 0));
    }

    public ThresholdCascade waterAnomalyCountCascade() {
        return ThresholdCascade.above(
                new ThresholdTier(AlertLevel.WARNING, "DROUGHT_RISK", water.warningAnomalyCount),
                new ThresholdTier(AlertLevel.WATCH, "AQUIFER_DECLINING", 0));
    }

    public ThresholdCascade portWaitingCascade() {
        return ThresholdCascade.above(
                new ThresholdTier(AlertLevel.CRITICAL, "PORT_GRIDLOCK", port.vesselsWaitingCritical),
                new ThresholdTier(AlertLevel.WARNING, "PORT_CONGESTION", port.vesselsWaitingWarning),
                new ThresholdTier(AlertLevel.WATCH, "PORT_BUSY", port.vesselsWaitingWatch));
    }

    public ThresholdCascade portDwellCascade() {
        return ThresholdCascade.above(
                new ThresholdTier(AlertLevel.CRITICAL, "PORT_GRIDLOCK", port.dwellHoursCritical),
                new ThresholdTier(AlertLevel.WARNING, "PORT_CONGESTION", port.dwellHoursWarning));
    }

    @Getter
    @Setter
    public static class Grid {
        /** Reserve margin percentages; a margin below the cutoff matches the tier. */
        private double reserveMarginWatch = 10.0;
        private double reserveMarginWarning = 5.0;
        private double reserveMarginCritical = 3.0;
    }

    @Getter
    @Setter
    public static class Water {
        /** Anomalies at or above this severity make the aquifer CRITICAL. */
        private double criticalSeverity = 0.75;
        /** More unacknowledged anomalies than this make it WARNING. */
        private int warningAnomalyCount = 3;
    }

    @Getter
    @Setter
    public static class Port {
        private double vesselsWaitingWatch = 5;
        private double vesselsWaitingWarning = 15;
        private double vesselsWaitingCritical = 30;
        private double dwellHoursWarning = 72;
        private double dwellHoursCritical = 96;
        /** Used in messages when the reporting station has no name. */
        private String defaultPortName = "Houston";
    }
}
