package com.linkedfate.entity;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alerts table.
 *
 * <p>Rows are inserted once per risk evaluation cycle and only the lifecycle columns
 * (is_active, is_acknowledged, acknowledged_at) change afterwards. The alert level is stored
 * as its name but compared through {@code level_rank} so that SQL ordering matches the enum's
 * severity order.
 */
@Entity
@Table(
        name = "alerts",
        indexes = {
            @Index(name = "idx_alert_triggered_at", columnList = "triggered_at DESC"),
            @Index(name = "idx_alert_active", columnList = "is_active")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, columnDefinition = "varchar(20)")
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_level", nullable = false, columnDefinition = "varchar(20)")
    private AlertLevel alertLevel;

    @Column(name = "level_rank", nullable = false)
    private int levelRank;

    @Column(name = "code", nullable = false, length = 100)
    private String code;

    @Column(name = "region_code", length = 20)
    private String regionCode;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    /** JSON-serialized {@code AlertPayload}, discriminated by its "kind" property. */
    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "triggered_at", nullable = false)
    private LocalDateTime triggeredAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_acknowledged", nullable = false)
    private boolean acknowledged;

    @Column(name = "acknowledged_at")
    private LocalDateTime acknowledgedAt;
}
