package com.linkedfate.api.controller;

import com.linkedfate.anomaly.AnomalyQueryService;
import com.linkedfate.domain.model.AnomalyView;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/anomalies")
public class AnomalyController {

    private final AnomalyQueryService anomalyQueryService;

    public AnomalyController(AnomalyQueryService anomalyQueryService) {
        this.anomalyQueryService = anomalyQueryService;
    }

    /** Anomalies detected in the last {@code hours}, most severe first. */
    @GetMapping
    public List<AnomalyView> getAnomalies(
            @RequestParam(defaultValue = "24") int hours,
            @RequestParam(defaultValue = "0") double minSeverity,
            @RequestParam(required = false) String indicatorCode,
            @RequestParam(defaultValue = "100") int limit) {
        return anomalyQueryService.getRecentAnomalies(hours, minSeverity, indicatorCode, limit);
    }

    @PostMapping("/{id}/acknowledge")
    public AnomalyView acknowledge(@PathVariable Long id) {
        return anomalyQueryService.acknowledge(id);
    }
}
