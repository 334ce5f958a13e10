package com.linkedfate.api.controller;

import com.linkedfate.alert.AlertStore;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.model.Alert;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the alert stream.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/alerts?activeOnly&alertType&alertLevel&limit} -- severity-then-recency sorted</li>
 *   <li>{@code GET /api/alerts/current} -- newest active alert per (type, title)</li>
 *   <li>{@code POST /api/alerts/{id}/acknowledge} -- idempotent, 404 when unknown</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertStore alertStore;

    public AlertController(AlertStore alertStore) {
        this.alertStore = alertStore;
    }

    @GetMapping
    public List<Alert> getAlerts(
            @RequestParam(defaultValue = "true") boolean activeOnly,
            @RequestParam(required = false) AlertType alertType,
            @RequestParam(required = false) AlertLevel alertLevel,
            @RequestParam(required = false) Integer limit) {
        return alertStore.query(activeOnly, alertType, alertLevel, limit);
    }

    @GetMapping("/current")
    public List<Alert> getCurrentStatus() {
        return alertStore.currentStatus();
    }

    @PostMapping("/{id}/acknowledge")
    public Alert acknowledge(@PathVariable Long id) {
        return alertStore.acknowledge(id);
    }
}
