package com.linkedfate.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.event.AnomalyDetectionCompletedEvent;
import com.linkedfate.event.CycleFailedEvent;
import com.linkedfate.event.RiskEvaluationCompletedEvent;
import com.linkedfate.observability.EngineMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EngineMetricsServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    private SimpleMeterRegistry registry;
    private EngineMetricsService engineMetricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engineMetricsService = new EngineMetricsService(registry);
    }

    @Test
    @DisplayName("detection cycle adds saved anomalies and records duration")
    void recordsAnomalyCycle() {
        AnomalyDetectionSummary summary = AnomalyDetectionSummary.builder()
                .cycleId("c1")
                .evaluatedAt(NOW)
                .lookbackHours(6)
                .anomaliesSaved(4)
                .savedByIndicator(Map.of("GW_LEVEL", 4))
                .durationMs(250)
                .build();

        engineMetricsService.onAnomalyDetectionCompleted(new AnomalyDetectionCompletedEvent(this, summary));
        engineMetricsService.onAnomalyDetectionCompleted(new AnomalyDetectionCompletedEvent(this, summary));

        assertThat(registry.get("linkedfate.anomalies.saved").counter().count()).isEqualTo(8.0);
        assertThat(registry.get("linkedfate.cycle.duration")
                        .tag("job", "anomaly-detection")
                        .timer()
                        .totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(500.0);
    }

    @Test
    @DisplayName("risk cycle counts alerts per level")
    void countsAlertsPerLevel() {
        Map<AlertLevel, Integer> counts = new EnumMap<>(AlertLevel.class);
        counts.put(AlertLevel.NORMAL, 2);
        counts.put(AlertLevel.WATCH, 0);
        counts.put(AlertLevel.WARNING, 1);
        counts.put(AlertLevel.CRITICAL, 3);
        RiskEvaluationSummary summary = RiskEvaluationSummary.builder()
                .cycleId("c2")
                .evaluatedAt(NOW)
                .totalAlerts(6)
                .countsByLevel(counts)
                .countsByDomain(Map.of())
                .degradedDomains(List.of())
                .durationMs(40)
                .build();

        engineMetricsService.onRiskEvaluationCompleted(new RiskEvaluationCompletedEvent(this, summary, List.of()));

        assertThat(registry.get("linkedfate.alerts.emitted").tag("level", "CRITICAL").counter().count())
                .isEqualTo(3.0);
        assertThat(registry.get("linkedfate.alerts.emitted").tag("level", "WARNING").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("linkedfate.alerts.emitted").tag("level", "WATCH").counter().count())
                .isZero();
        assertThat(registry.get("linkedfate.cycle.duration").tag("job", "risk-evaluation").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("failed cycles are counted per job")
    void countsFailures() {
        engineMetricsService.onCycleFailed(new CycleFailedEvent(this, "risk-evaluation", "timeout", 1));
        engineMetricsService.onCycleFailed(new CycleFailedEvent(this, "risk-evaluation", "Failed to persist alerts", 3));

        assertThat(registry.get("linkedfate.cycle.failures").tag("job", "risk-evaluation").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("linkedfate.cycle.failures").tag("job", "anomaly-detection").counter())
                .isNull();
    }
}
