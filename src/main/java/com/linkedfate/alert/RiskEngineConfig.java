package com.linkedfate.alert;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the risk evaluation cycle under the {@code linkedfate.risk}
 * prefix: alert TTL, cadence, timeout and retry policy, and query defaults.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "linkedfate.risk")
public class RiskEngineConfig {

    private boolean enabled = true;

    /** Alerts triggered longer ago than this are deactivated at the start of each cycle. */
    private int alertTtlMinutes = 60;

    private long intervalMs = 300_000;
    private int cycleTimeoutSeconds = 600;

    /** Retries after a persistence failure, on top of the first attempt. */
    private int maxRetries = 3;

    /** First retry delay; doubles on each further attempt. */
    private long retryDelayMs = 30_000;

    private int waterLookbackHours = 24;
    private int defaultQueryLimit = 200;
    private int maxQueryLimit = 1000;

    /** Region stamped on every alert the engine emits. */
    private String regionCode = "US-TX";

    @PostConstruct
    public void validate() {
        if (alertTtlMinutes <= 0 || cycleTimeoutSeconds <= 0 || waterLookbackHours <= 0) {
            throw new IllegalStateException("Risk TTL, timeout and lookback must be positive");
        }
        if (maxRetries < 0 || retryDelayMs < 1) {
            throw new IllegalStateException("Risk max-retries must not be negative and retry-delay-ms must be positive");
        }
        if (defaultQueryLimit <= 0 || defaultQueryLimit > maxQueryLimit) {
            throw new IllegalStateException("Default query limit must be within [1, maxQueryLimit]");
        }
    }
}
