package com.linkedfate.simulator;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Port traffic simulator settings under {@code linkedfate.simulator.port}. Baselines follow
 * published Port of Houston averages: 8 vessels at anchor, 48 hours at berth.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "linkedfate.simulator.port")
public class SimulatorConfig {

    private boolean enabled = false;

    /** Fixed seed for reproducible runs; null seeds from the clock. */
    private Long seed;

    private double startProbability = 0.05;
    private double resolveProbability = 0.20;

    private String portCode = "HOU";
    private double avgVesselsWaiting = 8;
    private double avgDwellHours = 48;

    private long intervalMs = 3_600_000;

    @PostConstruct
    public void validate() {
        if (startProbability < 0 || startProbability > 1 || resolveProbability < 0 || resolveProbability > 1) {
            throw new IllegalStateException("Simulator transition probabilities must be within [0, 1]");
        }
        if (avgVesselsWaiting <= 0 || avgDwellHours <= 0) {
            throw new IllegalStateException("Simulator baselines must be positive");
        }
    }
}
