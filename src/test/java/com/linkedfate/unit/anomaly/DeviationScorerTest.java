package com.linkedfate.unit.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.linkedfate.anomaly.DeviationScorer;
import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.model.Baseline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeviationScorerTest {

    private final DeviationScorer scorer = new DeviationScorer(2.0, 3.0, 4.0);

    @Nested
    @DisplayName("zScore")
    class ZScore {

        @Test
        @DisplayName("returns exactly 0 when stddev is zero")
        void zeroStddev() {
            assertThat(scorer.zScore(250.0, 100.0, 0.0)).isEqualTo(0.0);
            assertThat(scorer.classify(scorer.zScore(250.0, 100.0, 0.0))).isEqualTo(AnomalyType.NONE);
        }

        @Test
        @DisplayName("returns exactly 0 when stddev is NaN")
        void nanStddev() {
            assertThat(scorer.zScore(250.0, 100.0, Double.NaN)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("is signed (value - mean) / stddev")
        void signed() {
            assertThat(scorer.zScore(80.0, 100.0, 5.0)).isEqualTo(-4.0);
            assertThat(scorer.zScore(115.0, new Baseline(100.0, 5.0, 720))).isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("below threshold sigma is NONE")
        void none() {
            assertThat(scorer.classify(1.99)).isEqualTo(AnomalyType.NONE);
            assertThat(scorer.classify(-1.99)).isEqualTo(AnomalyType.NONE);
        }

        @Test
        @DisplayName("between threshold and critical sigma is SIGNIFICANT, on both sides of the mean")
        void significant() {
            assertThat(scorer.classify(2.0)).isEqualTo(AnomalyType.SIGNIFICANT_DEVIATION);
            assertThat(scorer.classify(-2.99)).isEqualTo(AnomalyType.SIGNIFICANT_DEVIATION);
        }

        @Test
        @DisplayName("at or beyond critical sigma is CRITICAL")
        void critical() {
            assertThat(scorer.classify(3.0)).isEqualTo(AnomalyType.CRITICAL_DEVIATION);
            assertThat(scorer.classify(-7.5)).isEqualTo(AnomalyType.CRITICAL_DEVIATION);
        }
    }

    @Nested
    @DisplayName("severity")
    class Severity {

        @Test
        @DisplayName("0.5 at the threshold, 0.75 at 3 sigma, 1.0 at 5 sigma")
        void referencePoints() {
            assertThat(scorer.severity(2.0)).isEqualTo(0.5);
            assertThat(scorer.severity(3.0)).isCloseTo(0.75, within(1e-12));
            assertThat(scorer.severity(5.0)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("0 below the threshold and saturates at 4 sigma")
        void bounds() {
            assertThat(scorer.severity(1.5)).isEqualTo(0.0);
            assertThat(scorer.severity(4.0)).isEqualTo(1.0);
            assertThat(scorer.severity(-12.0)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("is non-decreasing in |z|")
        void monotonic() {
            double previous = 0.0;
            for (double z = 0.0; z <= 6.0; z += 0.05) {
                double severity = scorer.severity(z);
                assertThat(severity).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
                assertThat(scorer.severity(-z)).isEqualTo(severity);
                previous = severity;
            }
        }
    }
}
