package com.linkedfate.anomaly;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for anomaly detection under the {@code linkedfate.anomaly} prefix.
 *
 * <p>The sigma thresholds must be strictly increasing:
 * {@code 0 < thresholdSigma < criticalSigma <= saturationSigma}. Severity is 0.5 at
 * {@code thresholdSigma} and reaches 1.0 at {@code saturationSigma}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "linkedfate.anomaly")
public class AnomalyDetectionConfig {

    private boolean enabled = true;
    private double thresholdSigma = 2.0;
    private double criticalSigma = 3.0;
    private double saturationSigma = 4.0;
    private int baselineWindowDays = 30;
    private int lookbackHours = 6;

    /** Cap on observations read per indicator and cycle. */
    private int maxObservationsPerQuery = 5000;

    private long intervalMs = 3_600_000;

    @PostConstruct
    public void validate() {
        if (thresholdSigma <= 0 || criticalSigma <= thresholdSigma || saturationSigma < criticalSigma) {
            throw new IllegalStateException(String.format(
                    "Sigma thresholds must satisfy 0 < threshold < critical <= saturation, got %.2f / %.2f / %.2f",
                    thresholdSigma, criticalSigma, saturationSigma));
        }
        if (baselineWindowDays <= 0 || lookbackHours <= 0 || maxObservationsPerQuery <= 0) {
            throw new IllegalStateException("Anomaly windows and query cap must be positive");
        }
    }
}
