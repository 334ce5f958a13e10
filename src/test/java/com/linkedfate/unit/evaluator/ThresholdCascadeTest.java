package com.linkedfate.unit.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.evaluator.EvaluatorThresholds;
import com.linkedfate.evaluator.ThresholdCascade;
import com.linkedfate.evaluator.ThresholdTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ThresholdCascadeTest {

    private final ThresholdCascade reserveMargin = new EvaluatorThresholds().gridReserveMarginCascade();

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("first crossed tier wins, most severe first")
        void mostSevereFirst() {
            assertThat(reserveMargin.match(2.0)).get().extracting(ThresholdTier::getCode).isEqualTo("GRID_EMERGENCY");
            assertThat(reserveMargin.match(4.0)).get().extracting(ThresholdTier::getCode).isEqualTo("GRID_STRAIN");
            assertThat(reserveMargin.match(8.0)).get().extracting(ThresholdTier::getCode).isEqualTo("GRID_MARGIN_LOW");
            assertThat(reserveMargin.match(15.0)).isEmpty();
        }

        @Test
        @DisplayName("strict BELOW: a value equal to the cutoff falls to the next tier")
        void strictBoundary() {
            assertThat(reserveMargin.levelOf(5.0)).isEqualTo(AlertLevel.WATCH);
            assertThat(reserveMargin.levelOf(3.0)).isEqualTo(AlertLevel.WARNING);
            assertThat(reserveMargin.levelOf(10.0)).isEqualTo(AlertLevel.NORMAL);
        }

        @Test
        @DisplayName("inclusive directions match on the cutoff itself")
        void inclusiveBoundary() {
            ThresholdCascade heat = ThresholdCascade.of(
                    ThresholdCascade.Direction.AT_OR_ABOVE,
                    new ThresholdTier(AlertLevel.WARNING, "EXTREME_HEAT", 105),
                    new ThresholdTier(AlertLevel.WATCH, "HIGH_HEAT", 100));

            assertThat(heat.levelOf(105)).isEqualTo(AlertLevel.WARNING);
            assertThat(heat.levelOf(100)).isEqualTo(AlertLevel.WATCH);
            assertThat(heat.levelOf(99.9)).isEqualTo(AlertLevel.NORMAL);
        }

        @Test
        @DisplayName("NaN never matches")
        void nanIsNormal() {
            assertThat(reserveMargin.match(Double.NaN)).isEmpty();
            assertThat(reserveMargin.levelOf(Double.NaN)).isEqualTo(AlertLevel.NORMAL);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("cutoffs out of order are rejected")
        void unorderedCutoffs() {
            assertThatThrownBy(() -> ThresholdCascade.below(
                            new ThresholdTier(AlertLevel.CRITICAL, "A", 10),
                            new ThresholdTier(AlertLevel.WARNING, "B", 5)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("levels must strictly decrease")
        void levelsDecrease() {
            assertThatThrownBy(() -> ThresholdCascade.above(
                            new ThresholdTier(AlertLevel.WATCH, "A", 30),
                            new ThresholdTier(AlertLevel.WARNING, "B", 15)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("NORMAL cannot be a tier")
        void normalTier() {
            assertThatThrownBy(() -> ThresholdCascade.above(new ThresholdTier(AlertLevel.NORMAL, "A", 1)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("misordered configured thresholds fail validation")
        void configuredThresholds() {
            EvaluatorThresholds thresholds = new EvaluatorThresholds();
            thresholds.getPort().setVesselsWaitingWarning(40);

            assertThatThrownBy(thresholds::validate).isInstanceOf(IllegalStateException.class);
        }
    }
}
