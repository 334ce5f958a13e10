package com.linkedfate.simulator;

import com.linkedfate.domain.enums.QualityFlag;
import com.linkedfate.evaluator.PortRiskEvaluator;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.observation.ObservationService;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Stands in for an AIS feed: writes simulated vessels-waiting and dwell-time readings for one
 * port every interval, shaped by time of day, weekday and hurricane season, and inflated while
 * the {@link CongestionStateMachine} is congested.
 *
 * <p>Only loaded when {@code linkedfate.simulator.port.enabled=true}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "linkedfate.simulator.port", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(SimulatorConfig.class)
public class PortTrafficSimulator {

    private final ObservationService observationService;
    private final SimulatorConfig simulatorConfig;
    private final Clock clock;
    private final Random random;
    private final CongestionStateMachine congestion;

    public PortTrafficSimulator(ObservationService observationService, SimulatorConfig simulatorConfig, Clock clock) {
        this.observationService = observationService;
        this.simulatorConfig = simulatorConfig;
        this.clock = clock;
        this.random = simulatorConfig.getSeed() != null ? new Random(simulatorConfig.getSeed()) : new Random();
        this.congestion = new CongestionStateMachine(
                random, simulatorConfig.getStartProbability(), simulatorConfig.getResolveProbability());
    }

    @Scheduled(
            fixedDelayString = "${linkedfate.simulator.port.interval-ms:3600000}",
            initialDelayString = "${linkedfate.simulator.port.initial-delay-ms:5000}")
    public void tick() {
        CongestionStateMachine.State before = congestion.getState();
        CongestionStateMachine.State after = congestion.step();
        if (before != after) {
            log.info("Port {} congestion {} -> {} (severity {})",
                    simulatorConfig.getPortCode(), before, after, String.format("%.2f", congestion.getSeverity()));
        }

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        try {
            generate(now).forEach((indicatorCode, value) -> observationService.putObservation(
                    indicatorCode,
                    simulatorConfig.getPortCode(),
                    null,
                    now,
                    value,
                    QualityFlag.SIMULATED.getCode()));
        } catch (ResourceNotFoundException e) {
            log.warn("Port simulator skipped this tick: {}", e.getMessage());
        }
    }

    /** Readings for the current congestion state at {@code at}, keyed by indicator code. Visible for testing. */
    public Map<String, Double> generate(LocalDateTime at) {
        double combined = hourMultiplier(at) * weekendMultiplier(at) * seasonalMultiplier(at);
        double congestionMultiplier = 1.0 + congestion.getSeverity();

        double waiting = simulatorConfig.getAvgVesselsWaiting() * combined * congestionMultiplier * uniform(0.5, 1.5);
        if (congestion.isCongested()) {
            waiting *= 1 + congestion.getSeverity() * 2;
        }
        double dwell = simulatorConfig.getAvgDwellHours() * congestionMultiplier * uniform(0.9, 1.3);

        Map<String, Double> readings = new LinkedHashMap<>();
        readings.put(PortRiskEvaluator.WAITING, round1(waiting));
        readings.put(PortRiskEvaluator.DWELL, round1(dwell));
        return readings;
    }

    // Visible for testing
    public CongestionStateMachine getCongestion() {
        return congestion;
    }

    private static double hourMultiplier(LocalDateTime at) {
        int hour = at.getHour();
        if (hour >= 8 && hour <= 18) {
            return 1.0 + 0.3 * Math.sin((hour - 8) * Math.PI / 10);
        }
        return 0.7;
    }

    private static double weekendMultiplier(LocalDateTime at) {
        DayOfWeek day = at.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? 0.7 : 1.0;
    }

    // Hurricane season, June through November
    private double seasonalMultiplier(LocalDateTime at) {
        int month = at.getMonthValue();
        return month >= 6 && month <= 11 ? 1.0 + uniform(-0.2, 0.3) : 1.0;
    }

    private double uniform(double low, double high) {
        return low + random.nextDouble() * (high - low);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
