package com.linkedfate.api.controller;

import com.linkedfate.alert.RiskEvaluationSummary;
import com.linkedfate.anomaly.AnomalyDetectionSummary;
import com.linkedfate.scheduler.EngineScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual cycle triggers for operators. Runs go through the same guard as the scheduled ones:
 * 409 while a cycle of the same job is in flight, 504 on timeout.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/engine/anomaly-detection?lookbackHours=6}</li>
 *   <li>{@code POST /api/engine/risk-evaluation}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final EngineScheduler engineScheduler;

    public EngineController(EngineScheduler engineScheduler) {
        this.engineScheduler = engineScheduler;
    }

    @PostMapping("/anomaly-detection")
    public AnomalyDetectionSummary runAnomalyDetection(@RequestParam(defaultValue = "6") int lookbackHours) {
        log.info("Manual anomaly detection requested: lookbackHours={}", lookbackHours);
        return engineScheduler.triggerAnomalyDetection(lookbackHours);
    }

    @PostMapping("/risk-evaluation")
    public RiskEvaluationSummary runRiskEvaluation() {
        log.info("Manual risk evaluation requested");
        return engineScheduler.triggerRiskEvaluation();
    }
}
