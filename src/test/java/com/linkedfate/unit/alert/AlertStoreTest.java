package com.linkedfate.unit.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.linkedfate.alert.AlertStore;
import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.GridPayload;
import com.linkedfate.entity.AlertEntity;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.repository.jpa.AlertJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class AlertStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 7, 15, 17, 0);

    @Mock
    private AlertJpaRepository alertJpaRepository;

    private AlertStore alertStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-07-15T17:00:00Z"), ZoneOffset.UTC);
        alertStore = new AlertStore(alertJpaRepository, new RiskEngineConfig(), clock);
    }

    private static AlertEntity storedAlert(long id, boolean acknowledged) {
        return AlertEntity.builder()
                .id(id)
                .alertType(AlertType.GRID)
                .alertLevel(AlertLevel.WARNING)
                .levelRank(AlertLevel.WARNING.ordinal())
                .code("GRID_STRAIN")
                .title("Grid Strain")
                .message("ERCOT RESERVE MARGIN LOW: 4.0%")
                .payload("{\"kind\":\"grid\",\"indicatorCode\":\"GRID_DEMAND\",\"reserveMarginPct\":4.0}")
                .triggeredAt(NOW.minusMinutes(10))
                .active(true)
                .acknowledged(acknowledged)
                .acknowledgedAt(acknowledged ? NOW.minusMinutes(5) : null)
                .build();
    }

    @Nested
    @DisplayName("persistCycle")
    class PersistCycle {

        @Test
        @DisplayName("expires alerts older than the TTL, then inserts the cycle as active")
        void expiresThenInserts() {
            AtomicLong ids = new AtomicLong(100);
            when(alertJpaRepository.deactivateTriggeredBefore(NOW.minusMinutes(60))).thenReturn(4);
            when(alertJpaRepository.saveAllAndFlush(anyList())).thenAnswer(invocation -> {
                List<AlertEntity> entities = invocation.getArgument(0);
                entities.forEach(entity -> entity.setId(ids.incrementAndGet()));
                return entities;
            });
            Alert alert = Alert.builder()
                    .alertType(AlertType.GRID)
                    .alertLevel(AlertLevel.CRITICAL)
                    .code("GRID_EMERGENCY")
                    .title("Grid Emergency")
                    .message("ERCOT RESERVE MARGIN CRITICAL: 2.0%")
                    .payload(GridPayload.builder().indicatorCode("GRID_DEMAND").reserveMarginPct(2.0).build())
                    .triggeredAt(NOW)
                    .acknowledged(true)
                    .build();

            AlertStore.PersistedCycle persisted = alertStore.persistCycle(List.of(alert));

            assertThat(persisted.getDeactivated()).isEqualTo(4);
            assertThat(persisted.getAlerts()).hasSize(1);
            Alert saved = persisted.getAlerts().get(0);
            assertThat(saved.getAlertId()).isEqualTo(101L);
            assertThat(saved.isActive()).isTrue();
            assertThat(saved.isAcknowledged()).isFalse();
            assertThat(((GridPayload) saved.getPayload()).getReserveMarginPct()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("acknowledge")
    class Acknowledge {

        @Test
        @DisplayName("first call stamps acknowledgedAt and leaves active alone")
        void stamps() {
            AlertEntity stored = storedAlert(7L, false);
            when(alertJpaRepository.findById(7L)).thenReturn(Optional.of(stored));
            when(alertJpaRepository.save(stored)).thenReturn(stored);

            Alert alert = alertStore.acknowledge(7L);

            assertThat(alert.isAcknowledged()).isTrue();
            assertThat(alert.getAcknowledgedAt()).isEqualTo(NOW);
            assertThat(alert.isActive()).isTrue();
            assertThat(alert.getPayload()).isInstanceOf(GridPayload.class);
        }

        @Test
        @DisplayName("second call is a no-op that keeps the original timestamp")
        void idempotent() {
            when(alertJpaRepository.findById(7L)).thenReturn(Optional.of(storedAlert(7L, true)));

            Alert alert = alertStore.acknowledge(7L);

            assertThat(alert.getAcknowledgedAt()).isEqualTo(NOW.minusMinutes(5));
            verify(alertJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknown id is a not-found error")
        void unknown() {
            when(alertJpaRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> alertStore.acknowledge(99L)).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("query")
    class Query {

        @Test
        @DisplayName("active-only reads current status with the default limit")
        void activeOnly() {
            when(alertJpaRepository.findCurrentStatus(AlertType.GRID, null, PageRequest.of(0, 200)))
                    .thenReturn(List.of(storedAlert(7L, false)));

            List<Alert> alerts = alertStore.query(true, AlertType.GRID, null, null);

            assertThat(alerts).extracting(Alert::getAlertId).containsExactly(7L);
        }

        @Test
        @DisplayName("history reads every row up to the limit")
        void history() {
            when(alertJpaRepository.findFiltered(null, AlertLevel.WARNING, PageRequest.of(0, 5)))
                    .thenReturn(List.of(storedAlert(7L, false), storedAlert(6L, true)));

            assertThat(alertStore.query(false, null, AlertLevel.WARNING, 5)).hasSize(2);
        }

        @Test
        @DisplayName("limit outside [1, max] is rejected")
        void limitValidated() {
            assertThatThrownBy(() -> alertStore.query(true, null, null, 0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> alertStore.query(true, null, null, 1001))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(alertJpaRepository);
        }
    }
}
