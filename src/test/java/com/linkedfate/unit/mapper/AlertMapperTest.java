package com.linkedfate.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.CompositePayload;
import com.linkedfate.domain.payload.WaterPayload;
import com.linkedfate.entity.AlertEntity;
import com.linkedfate.mapper.AlertMapper;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for the AlertMapper (MapStruct).
 *
 * <p>Covers the JSON payload column and the derived level rank.
 */
class AlertMapperTest {

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    @Test
    @DisplayName("toEntity writes the payload as JSON with its kind and derives levelRank")
    void toEntityWritesPayloadJson() {
        Map<String, AlertLevel> domainLevels = new LinkedHashMap<>();
        domainLevels.put("GRID", AlertLevel.CRITICAL);
        domainLevels.put("WATR", AlertLevel.CRITICAL);
        domainLevels.put("FLOW", AlertLevel.WARNING);

        Alert alert = Alert.builder()
                .alertId(3L)
                .alertType(AlertType.LINKED)
                .alertLevel(AlertLevel.CRITICAL)
                .code("TEXAS_PERFECT_STORM")
                .regionCode("US-TX")
                .title("Texas Perfect Storm")
                .message("Grid, water and port stress at once")
                .payload(CompositePayload.builder()
                        .ruleCode("TEXAS_PERFECT_STORM")
                        .domainLevels(domainLevels)
                        .sentimentScore(-0.6)
                        .confidence(Confidence.STRONG)
                        .build())
                .triggeredAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                .build();

        AlertEntity entity = alertMapper.toEntity(alert);

        assertThat(entity.getId()).isEqualTo(3L);
        assertThat(entity.getAlertType()).isEqualTo(AlertType.LINKED);
        assertThat(entity.getLevelRank()).isEqualTo(AlertLevel.CRITICAL.ordinal());
        assertThat(entity.isActive()).isTrue();
        assertThat(entity.getPayload())
                .contains("\"kind\":\"composite\"")
                .contains("\"ruleCode\":\"TEXAS_PERFECT_STORM\"")
                .contains("\"FLOW\":\"WARNING\"");
    }

    @Test
    @DisplayName("toDomain restores the concrete payload type")
    void toDomainRestoresPayloadType() {
        AlertEntity entity = AlertEntity.builder()
                .id(8L)
                .alertType(AlertType.WATR)
                .alertLevel(AlertLevel.WARNING)
                .levelRank(AlertLevel.WARNING.ordinal())
                .code("WATER_STRESS")
                .title("Water Stress")
                .message("4 groundwater anomalies in 24h")
                .payload("{\"kind\":\"water\",\"indicatorCode\":\"GW_LEVEL\",\"anomalyCount\":4,"
                        + "\"criticalAnomalyCount\":0,\"averageLevel\":100.0,\"observationCount\":3,"
                        + "\"addedLater\":true}")
                .triggeredAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                .active(true)
                .build();

        Alert alert = alertMapper.toDomain(entity);

        assertThat(alert.getAlertId()).isEqualTo(8L);
        assertThat(alert.getPayload()).isInstanceOf(WaterPayload.class);
        WaterPayload payload = (WaterPayload) alert.getPayload();
        assertThat(payload.getAnomalyCount()).isEqualTo(4);
        assertThat(payload.getAverageLevel()).isEqualTo(100.0);
        assertThat(alert.getPayload().indicatorCode()).isEqualTo("GW_LEVEL");
    }

    @Test
    @DisplayName("null payload maps to null both ways")
    void nullPayload() {
        Alert alert = Alert.builder()
                .alertType(AlertType.GRID)
                .alertLevel(AlertLevel.NORMAL)
                .code("GRID_NORMAL")
                .triggeredAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                .build();

        AlertEntity entity = alertMapper.toEntity(alert);

        assertThat(entity.getPayload()).isNull();
        assertThat(alertMapper.toDomain(entity).getPayload()).isNull();
    }

    @Test
    @DisplayName("unreadable payload JSON fails loudly")
    void unreadablePayload() {
        AlertEntity entity = AlertEntity.builder()
                .id(9L)
                .alertType(AlertType.GRID)
                .alertLevel(AlertLevel.WATCH)
                .payload("{\"kind\":\"unknown-kind\"}")
                .build();

        assertThatThrownBy(() -> alertMapper.toDomain(entity)).isInstanceOf(IllegalStateException.class);
    }
}
