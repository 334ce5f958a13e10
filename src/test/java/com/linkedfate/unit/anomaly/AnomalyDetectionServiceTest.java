package com.linkedfate.unit.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.linkedfate.anomaly.AnomalyDetectionService;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.anomaly.AnomalyDetector;
import com.linkedfate.anomaly.AnomalyRecorder;
import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.model.Anomaly;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.event.EventPublisherHelper;
import com.linkedfate.exception.PersistenceFailureException;
import com.linkedfate.exception.UpstreamFetchException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionSystemException;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    @Mock
    private IndicatorJpaRepository indicatorJpaRepository;

    @Mock
    private AnomalyDetector anomalyDetector;

    @Mock
    private AnomalyRecorder anomalyRecorder;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private AnomalyDetectionService anomalyDetectionService;

    private final IndicatorEntity gwLevel =
            IndicatorEntity.builder().id(1L).code("GW_LEVEL").functionCode("WATR").build();
    private final IndicatorEntity portWaiting =
            IndicatorEntity.builder().id(2L).code("PORT_WAITING").functionCode("FLOW").build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        anomalyDetectionService = new AnomalyDetectionService(
                indicatorJpaRepository, anomalyDetector, anomalyRecorder, eventPublisherHelper, clock);
    }

    private Anomaly anomaly(Long indicatorId, AnomalyType type) {
        return Anomaly.builder()
                .indicatorId(indicatorId)
                .stationId(9L)
                .detectedAt(NOW.minusHours(1))
                .anomalyType(type)
                .severity(type == AnomalyType.CRITICAL_DEVIATION ? 0.9 : 0.6)
                .build();
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("non-positive lookback is rejected before any read")
        void rejectsNonPositiveLookback() {
            assertThatThrownBy(() -> anomalyDetectionService.runAnomalyDetection(0))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(indicatorJpaRepository, anomalyDetector, anomalyRecorder, eventPublisherHelper);
        }
    }

    @Nested
    @DisplayName("Cycle")
    class Cycle {

        @Test
        @DisplayName("summary counts saved anomalies per indicator and by type")
        void summarizesSaved() {
            when(indicatorJpaRepository.findAll()).thenReturn(List.of(gwLevel, portWaiting));
            Anomaly critical = anomaly(1L, AnomalyType.CRITICAL_DEVIATION);
            Anomaly significant = anomaly(2L, AnomalyType.SIGNIFICANT_DEVIATION);
            when(anomalyDetector.detectForIndicator(argThat(i -> i != null && i.getId() == 1L), eq(NOW.minusHours(6))))
                    .thenReturn(List.of(critical));
            when(anomalyDetector.detectForIndicator(argThat(i -> i != null && i.getId() == 2L), eq(NOW.minusHours(6))))
                    .thenReturn(List.of(significant));
            when(anomalyRecorder.saveNew(List.of(critical, significant))).thenReturn(List.of(critical, significant));

            AnomalyDetectionSummary summary = anomalyDetectionService.runAnomalyDetection(6);

            assertThat(summary.getIndicatorsScanned()).isEqualTo(2);
            assertThat(summary.getAnomaliesDetected()).isEqualTo(2);
            assertThat(summary.getAnomaliesSaved()).isEqualTo(2);
            assertThat(summary.getCriticalCount()).isEqualTo(1);
            assertThat(summary.getSignificantCount()).isEqualTo(1);
            assertThat(summary.getSavedByIndicator()).containsEntry("GW_LEVEL", 1).containsEntry("PORT_WAITING", 1);
            assertThat(summary.getEvaluatedAt()).isEqualTo(NOW);
            assertThat(summary.getCycleId()).hasSize(8);
            verify(eventPublisherHelper).publishAnomalyDetectionCompleted(anomalyDetectionService, summary);
        }

        @Test
        @DisplayName("a failed read skips that indicator and the cycle continues")
        void failedIndicatorSkipped() {
            when(indicatorJpaRepository.findAll()).thenReturn(List.of(gwLevel, portWaiting));
            Anomaly significant = anomaly(2L, AnomalyType.SIGNIFICANT_DEVIATION);
            when(anomalyDetector.detectForIndicator(argThat(i -> i != null && i.getId() == 1L), any()))
                    .thenThrow(new QueryTimeoutException("slow scan"));
            when(anomalyDetector.detectForIndicator(argThat(i -> i != null && i.getId() == 2L), any()))
                    .thenReturn(List.of(significant));
            when(anomalyRecorder.saveNew(List.of(significant))).thenReturn(List.of(significant));

            AnomalyDetectionSummary summary = anomalyDetectionService.runAnomalyDetection(6);

            assertThat(summary.getAnomaliesSaved()).isEqualTo(1);
            assertThat(summary.getSavedByIndicator()).containsOnlyKeys("PORT_WAITING");
        }

        @Test
        @DisplayName("a failed write surfaces as a persistence failure and publishes nothing")
        void writeFailure() {
            when(indicatorJpaRepository.findAll()).thenReturn(List.of(gwLevel));
            when(anomalyDetector.detectForIndicator(any(), any()))
                    .thenReturn(List.of(anomaly(1L, AnomalyType.CRITICAL_DEVIATION)));
            when(anomalyRecorder.saveNew(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> anomalyDetectionService.runAnomalyDetection(6))
                    .isInstanceOf(PersistenceFailureException.class);
            verify(eventPublisherHelper, never()).publishAnomalyDetectionCompleted(any(), any());
        }

        @Test
        @DisplayName("a failed commit also surfaces as a persistence failure")
        void commitFailure() {
            when(indicatorJpaRepository.findAll()).thenReturn(List.of(gwLevel));
            when(anomalyDetector.detectForIndicator(any(), any()))
                    .thenReturn(List.of(anomaly(1L, AnomalyType.CRITICAL_DEVIATION)));
            when(anomalyRecorder.saveNew(anyList())).thenThrow(new TransactionSystemException("commit failed"));

            assertThatThrownBy(() -> anomalyDetectionService.runAnomalyDetection(6))
                    .isInstanceOf(PersistenceFailureException.class)
                    .hasCauseInstanceOf(TransactionSystemException.class);
            verify(eventPublisherHelper, never()).publishAnomalyDetectionCompleted(any(), any());
        }

        @Test
        @DisplayName("failing to load indicators is an upstream fetch failure")
        void indicatorLoadFailure() {
            when(indicatorJpaRepository.findAll()).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> anomalyDetectionService.runAnomalyDetection(6))
                    .isInstanceOf(UpstreamFetchException.class);
            verifyNoInteractions(anomalyRecorder);
        }
    }
}
