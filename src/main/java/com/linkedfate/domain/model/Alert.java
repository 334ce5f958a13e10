package com.linkedfate.domain.model;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.payload.AlertPayload;
import java.time.LocalDateTime;
import java.util.Comparator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A severity-leveled alert produced by a domain evaluator or the correlation engine.
 *
 * <p>{@code code} is the machine identifier (e.g. GRID_STRAIN, TEXAS_PERFECT_STORM); the
 * stored {@code title} is derived from it and, together with {@code alertType}, forms the
 * "current status" key in the alert store.
 *
 * <p>Alerts are inserted once per evaluation cycle and never updated in place, apart from
 * the lifecycle flags ({@code active}, {@code acknowledged}, {@code acknowledgedAt}).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Alert {

    /** Severity descending, then most recent first. */
    public static final Comparator<Alert> SEVERITY_THEN_RECENCY = Comparator.comparing(Alert::getAlertLevel)
            .reversed()
            .thenComparing(Alert::getTriggeredAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private Long alertId;
    private AlertType alertType;
    private AlertLevel alertLevel;
    private String code;
    private String regionCode;
    private String title;
    private String message;
    private AlertPayload payload;
    private LocalDateTime triggeredAt;

    @Builder.Default
    private boolean active = true;

    private boolean acknowledged;
    private LocalDateTime acknowledgedAt;

    /** Converts GRID_STRAIN into "Grid Strain". */
    public static String titleFromCode(String code) {
        if (code == null || code.isBlank()) {
            return code;
        }
        StringBuilder title = new StringBuilder();
        for (String word : code.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase());
        }
        return title.toString();
    }
}
