package com.linkedfate.unit.alert;

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

import com.linkedfate.alert.AlertStore;
import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.alert.RiskEvaluationService;
import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.correlation.LinkedFateEngine;
import com.linkedfate.correlation.SignalSnapshotReader;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import com.linkedfate.domain.payload.DegradedPayload;
import com.linkedfate.evaluator.DomainEvaluator;
import com.linkedfate.event.EventPublisherHelper;
import com.linkedfate.exception.PersistenceFailureException;
import com.linkedfate.exception.UpstreamFetchException;
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
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class RiskEvaluationServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 7, 15, 17, 0);

    @Mock
    private DomainEvaluator gridEvaluator;

    @Mock
    private DomainEvaluator waterEvaluator;

    @Mock
    private DomainEvaluator portEvaluator;

    @Mock
    private SignalSnapshotReader signalSnapshotReader;

    @Mock
    private LinkedFateEngine linkedFateEngine;

    @Mock
    private AlertStore alertStore;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private RiskEvaluationService riskEvaluationService;

    @BeforeEach
    void setUp() {
        when(gridEvaluator.domain()).thenReturn(Domain.GRID);
        when(waterEvaluator.domain()).thenReturn(Domain.WATER);
        when(portEvaluator.domain()).thenReturn(Domain.PORT);
        Clock clock = Clock.fixed(Instant.parse("2026-07-15T17:00:00Z"), ZoneOffset.UTC);
        riskEvaluationService = new RiskEvaluationService(
                List.of(portEvaluator, gridEvaluator, waterEvaluator),
                signalSnapshotReader,
                linkedFateEngine,
                alertStore,
                eventPublisherHelper,
                new RiskEngineConfig(),
                clock);
    }

    private static Alert alert(AlertType type, AlertLevel level, String code) {
        return Alert.builder()
                .alertType(type)
                .alertLevel(level)
                .code(code)
                .title(Alert.titleFromCode(code))
                .triggeredAt(NOW)
                .build();
    }

    private void persistAsGiven() {
        when(alertStore.persistCycle(anyList()))
                .thenAnswer(invocation -> new AlertStore.PersistedCycle(invocation.getArgument(0), 2));
    }

    @SuppressWarnings("unchecked")
    private List<Alert> persistedAlerts() {
        ArgumentCaptor<List<Alert>> captor = ArgumentCaptor.forClass(List.class);
        verify(alertStore).persistCycle(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Ordering and summary")
    class OrderingAndSummary {

        @Test
        @DisplayName("composites come first, each group by severity")
        void compositesFirst() {
            Alert grid = alert(AlertType.GRID, AlertLevel.WARNING, "GRID_STRAIN");
            Alert water = alert(AlertType.WATR, AlertLevel.NORMAL, "WATR_NORMAL");
            Alert port = alert(AlertType.FLOW, AlertLevel.CRITICAL, "PORT_GRIDLOCK");
            Alert supplyChain = alert(AlertType.LINKED, AlertLevel.WARNING, "TEXAS_SUPPLY_CHAIN_CRITICAL");
            Alert market = alert(AlertType.MARKET, AlertLevel.CRITICAL, "TRIPLE_FLOW_CONFIRMED");
            when(gridEvaluator.evaluate()).thenReturn(grid);
            when(waterEvaluator.evaluate()).thenReturn(water);
            when(portEvaluator.evaluate()).thenReturn(port);
            CorrelationSignals signals = CorrelationSignals.empty();
            when(signalSnapshotReader.read(List.of(grid, water, port))).thenReturn(signals);
            when(linkedFateEngine.evaluate(List.of(grid, water, port), signals)).thenReturn(List.of(supplyChain, market));
            persistAsGiven();

            RiskEvaluationSummary summary = riskEvaluationService.runRiskEvaluation();

            assertThat(persistedAlerts()).containsExactly(market, supplyChain, port, grid, water);
            assertThat(summary.getTotalAlerts()).isEqualTo(5);
            assertThat(summary.getLinkedCount()).isEqualTo(2);
            assertThat(summary.getDeactivatedCount()).isEqualTo(2);
            assertThat(summary.getCountsByLevel())
                    .containsEntry(AlertLevel.CRITICAL, 2)
                    .containsEntry(AlertLevel.WARNING, 2)
                    .containsEntry(AlertLevel.WATCH, 0)
                    .containsEntry(AlertLevel.NORMAL, 1);
            assertThat(summary.getCountsByDomain()).containsEntry("MARKET", 1).containsEntry("GRID", 1);
            assertThat(summary.getDegradedDomains()).isEmpty();
            assertThat(summary.isCorrelationFailed()).isFalse();
            verify(eventPublisherHelper).publishRiskEvaluationCompleted(eq(riskEvaluationService), eq(summary), anyList());
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("a failing evaluator degrades to a NORMAL unavailable alert")
        void evaluatorFailure() {
            Alert grid = alert(AlertType.GRID, AlertLevel.NORMAL, "GRID_NORMAL");
            Alert port = alert(AlertType.FLOW, AlertLevel.NORMAL, "PORT_NORMAL");
            when(gridEvaluator.evaluate()).thenReturn(grid);
            when(waterEvaluator.evaluate())
                    .thenThrow(new UpstreamFetchException("GW_LEVEL", new QueryTimeoutException("slow")));
            when(portEvaluator.evaluate()).thenReturn(port);
            when(signalSnapshotReader.read(anyList())).thenReturn(CorrelationSignals.empty());
            when(linkedFateEngine.evaluate(anyList(), any())).thenReturn(List.of());
            persistAsGiven();

            RiskEvaluationSummary summary = riskEvaluationService.runRiskEvaluation();

            List<Alert> persisted = persistedAlerts();
            assertThat(persisted).extracting(Alert::getCode)
                    .containsExactlyInAnyOrder("GRID_NORMAL", "WATR_UNAVAILABLE", "PORT_NORMAL");
            Alert unavailable = persisted.stream()
                    .filter(a -> a.getCode().equals("WATR_UNAVAILABLE"))
                    .findFirst()
                    .orElseThrow();
            assertThat(unavailable.getAlertLevel()).isEqualTo(AlertLevel.NORMAL);
            assertThat(unavailable.getAlertType()).isEqualTo(AlertType.WATR);
            assertThat(unavailable.getMessage()).isEqualTo("WATR data temporarily unavailable");
            assertThat(unavailable.getPayload()).isInstanceOf(DegradedPayload.class);
            assertThat(summary.getDegradedDomains()).containsExactly("WATR");
            verify(linkedFateEngine).evaluate(argThat(alerts -> alerts.size() == 3), any());
        }

        @Test
        @DisplayName("a correlation failure still persists the domain alerts")
        void correlationFailure() {
            when(gridEvaluator.evaluate()).thenReturn(alert(AlertType.GRID, AlertLevel.WARNING, "GRID_STRAIN"));
            when(waterEvaluator.evaluate()).thenReturn(alert(AlertType.WATR, AlertLevel.NORMAL, "WATR_NORMAL"));
            when(portEvaluator.evaluate()).thenReturn(alert(AlertType.FLOW, AlertLevel.NORMAL, "PORT_NORMAL"));
            when(signalSnapshotReader.read(anyList()))
                    .thenThrow(new UpstreamFetchException("correlation signals", new QueryTimeoutException("slow")));
            persistAsGiven();

            RiskEvaluationSummary summary = riskEvaluationService.runRiskEvaluation();

            assertThat(persistedAlerts()).hasSize(3);
            assertThat(summary.isCorrelationFailed()).isTrue();
            assertThat(summary.getLinkedCount()).isZero();
            verifyNoInteractions(linkedFateEngine);
        }

        @Test
        @DisplayName("a write failure surfaces as a persistence failure and publishes nothing")
        void writeFailure() {
            when(gridEvaluator.evaluate()).thenReturn(alert(AlertType.GRID, AlertLevel.NORMAL, "GRID_NORMAL"));
            when(waterEvaluator.evaluate()).thenReturn(alert(AlertType.WATR, AlertLevel.NORMAL, "WATR_NORMAL"));
            when(portEvaluator.evaluate()).thenReturn(alert(AlertType.FLOW, AlertLevel.NORMAL, "PORT_NORMAL"));
            when(signalSnapshotReader.read(anyList())).thenReturn(CorrelationSignals.empty());
            when(linkedFateEngine.evaluate(anyList(), any())).thenReturn(List.of());
            when(alertStore.persistCycle(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> riskEvaluationService.runRiskEvaluation())
                    .isInstanceOf(PersistenceFailureException.class);
            verify(eventPublisherHelper, never()).publishRiskEvaluationCompleted(any(), any(), anyList());
        }
    }
}
