package com.linkedfate.evaluator;

import com.linkedfate.alert.RiskEngineConfig;
import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.PortPayload;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.entity.StationEntity;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import java.time.Clock;
import java.util.Optional;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Port logistics evaluator. The level is the worse of the vessels-waiting cascade and the
 * dwell-time cascade, so either a long queue or long berth times can escalate the port.
 */
@Component
@EnableConfigurationProperties({EvaluatorThresholds.class, RiskEngineConfig.class})
public class PortRiskEvaluator extends AbstractDomainEvaluator {

    public static final String WAITING = "PORT_WAITING";
    public static final String DWELL = "PORT_DWELL";

    private final ObservationJpaRepository observationJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final EvaluatorThresholds evaluatorThresholds;

    public PortRiskEvaluator(
            IndicatorJpaRepository indicatorJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            StationJpaRepository stationJpaRepository,
            EvaluatorThresholds evaluatorThresholds,
            RiskEngineConfig riskEngineConfig,
            Clock clock) {
        super(indicatorJpaRepository, clock, riskEngineConfig.getRegionCode());
        this.observationJpaRepository = observationJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.evaluatorThresholds = evaluatorThresholds;
    }

    @Override
    public Domain domain() {
        return Domain.PORT;
    }

    @Override
    public Alert evaluate() {
        String defaultPort = evaluatorThresholds.getPort().getDefaultPortName();
        Optional<ObservationEntity> waiting = latest(WAITING);
        if (waiting.isEmpty()) {
            return newAlert(
                    AlertLevel.NORMAL,
                    "PORT_NORMAL",
                    defaultPort + " port data not yet available",
                    PortPayload.builder().indicatorCode(WAITING).port(defaultPort).build());
        }

        String port = portName(waiting.get().getStationId(), defaultPort);
        double vesselsWaiting = waiting.get().getValue();
        Double dwellHours = latest(DWELL).map(ObservationEntity::getValue).orElse(null);

        Optional<ThresholdTier> byWaiting = evaluatorThresholds.portWaitingCascade().match(vesselsWaiting);
        Optional<ThresholdTier> byDwell = dwellHours != null
                ? evaluatorThresholds.portDwellCascade().match(dwellHours)
                : Optional.empty();
        Optional<ThresholdTier> tier = worse(byWaiting, byDwell);

        PortPayload.PortPayloadBuilder payload = PortPayload.builder()
                .indicatorCode(WAITING)
                .port(port)
                .vesselsWaiting(vesselsWaiting)
                .dwellHours(dwellHours);

        if (tier.isEmpty()) {
            return newAlert(
                    AlertLevel.NORMAL,
                    "PORT_NORMAL",
                    String.format("%s normal: %.0f vessels waiting", port, vesselsWaiting),
                    payload.build());
        }

        ThresholdTier matched = tier.get();
        String message = switch (matched.getLevel()) {
            case CRITICAL -> String.format("PORT GRIDLOCK: %.0f vessels waiting at %s", vesselsWaiting, port);
            case WARNING -> String.format("PORT CONGESTION: %.0f vessels waiting", vesselsWaiting);
            default -> String.format("Port traffic elevated: %.0f vessels waiting", vesselsWaiting);
        };
        // Report the vessels-waiting cutoff of the matched level, as the queue is the headline metric.
        double threshold = evaluatorThresholds.portWaitingCascade().getTiers().stream()
                .filter(t -> t.getLevel() == matched.getLevel())
                .mapToDouble(ThresholdTier::getCutoff)
                .findFirst()
                .orElse(matched.getCutoff());
        return newAlert(matched.getLevel(), matched.getCode(), message, payload.threshold(threshold).build());
    }

    private static Optional<ThresholdTier> worse(Optional<ThresholdTier> a, Optional<ThresholdTier> b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return b.get().getLevel().compareTo(a.get().getLevel()) > 0 ? b : a;
    }

    private Optional<ObservationEntity> latest(String indicatorCode) {
        Optional<IndicatorEntity> indicator = indicator(indicatorCode);
        if (indicator.isEmpty()) {
            return Optional.empty();
        }
        return read(
                indicatorCode,
                () -> observationJpaRepository.findFirstByIndicatorIdOrderByObservedAtDesc(
                        indicator.get().getId()));
    }

    private String portName(Long stationId, String defaultPort) {
        if (stationId == null) {
            return defaultPort;
        }
        return read("stations", () -> stationJpaRepository.findById(stationId))
                .map(StationEntity::getName)
                .filter(name -> !name.isBlank())
                .orElse(defaultPort);
    }
}
