package com.linkedfate.correlation;

import com.linkedfate.domain.enums.Domain;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.model.CorrelationSignals;
import com.linkedfate.domain.model.ForecastReading;
import com.linkedfate.domain.model.MarketMove;
import com.linkedfate.domain.payload.GridPayload;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.entity.StationEntity;
import com.linkedfate.exception.UpstreamFetchException;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads the non-physical correlation inputs for one cycle from the observation store.
 *
 * <ul>
 *   <li>Market moves: latest {@code EQUITY_CHANGE_PCT} per station; the station external id is
 *       the ticker symbol.</li>
 *   <li>Sentiment: {@code NEWS_SENTIMENT} averaged per station over the sentiment window; the
 *       station external id is the domain code (GRID, WATR, FLOW).</li>
 *   <li>Forecasts: latest value per location of each 48h forecast indicator.</li>
 *   <li>Grid reserve margin: taken from this cycle's grid alert.</li>
 * </ul>
 *
 * <p>Indicators that are not registered simply contribute nothing.
 */
@Component
@EnableConfigurationProperties(CorrelationConfig.class)
public class SignalSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SignalSnapshotReader.class);

    public static final String EQUITY_CHANGE_PCT = "EQUITY_CHANGE_PCT";
    public static final String NEWS_SENTIMENT = "NEWS_SENTIMENT";

    private static final List<String> FORECAST_INDICATORS = List.of(
            LinkedFateRuleTable.FORECAST_MAX_TEMP,
            LinkedFateRuleTable.FORECAST_MIN_TEMP,
            LinkedFateRuleTable.FORECAST_STORM_ALERT);

    private final IndicatorJpaRepository indicatorJpaRepository;
    private final ObservationJpaRepository observationJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final CorrelationConfig config;
    private final Clock clock;

    public SignalSnapshotReader(
            IndicatorJpaRepository indicatorJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            StationJpaRepository stationJpaRepository,
            CorrelationConfig config,
            Clock clock) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.observationJpaRepository = observationJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws UpstreamFetchException if the observation store cannot be read
     */
    @Transactional(readOnly = true)
    public CorrelationSignals read(Collection<Alert> domainAlerts) {
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            CorrelationSignals.CorrelationSignalsBuilder signals = CorrelationSignals.builder();
            readMarketMoves(now, signals);
            readSentiment(now, signals);
            readForecasts(now, signals);
            reserveMargin(domainAlerts).ifPresent(margin -> signals.metric(CorrelationSignals.GRID_RESERVE_MARGIN, margin));
            CorrelationSignals snapshot = signals.build();
            log.debug(
                    "Signals: {} market moves, sentiment {}, {} forecasts, metrics {}",
                    snapshot.getMarketMoves().size(),
                    snapshot.getSentimentByDomain(),
                    snapshot.getForecasts().size(),
                    snapshot.getMetrics());
            return snapshot;
        } catch (DataAccessException e) {
            throw new UpstreamFetchException("correlation signals", e);
        }
    }

    private void readMarketMoves(LocalDateTime now, CorrelationSignals.CorrelationSignalsBuilder signals) {
        Optional<IndicatorEntity> indicator = indicatorJpaRepository.findByCode(EQUITY_CHANGE_PCT);
        if (indicator.isEmpty()) {
            return;
        }
        List<ObservationEntity> latest = latestPerStation(indicator.get(), now);
        Map<Long, StationEntity> stations = stations(latest);
        for (ObservationEntity observation : latest) {
            StationEntity station = stations.get(observation.getStationId());
            if (station == null) {
                continue;
            }
            signals.marketMove(MarketMove.builder()
                    .symbol(station.getExternalId())
                    .name(station.getName())
                    .changePercent(observation.getValue())
                    .observedAt(observation.getObservedAt())
                    .build());
        }
    }

    private void readSentiment(LocalDateTime now, CorrelationSignals.CorrelationSignalsBuilder signals) {
        Optional<IndicatorEntity> indicator = indicatorJpaRepository.findByCode(NEWS_SENTIMENT);
        if (indicator.isEmpty()) {
            return;
        }
        List<ObservationEntity> recent = observationJpaRepository.findSince(
                indicator.get().getId(),
                now.minusHours(config.getSentimentWindowHours()),
                PageRequest.of(0, config.getMaxSignalRows()));
        Map<Long, double[]> sums = new LinkedHashMap<>();
        for (ObservationEntity observation : recent) {
            if (observation.getStationId() == null) {
                continue;
            }
            double[] sum = sums.computeIfAbsent(observation.getStationId(), id -> new double[2]);
            sum[0] += observation.getValue();
            sum[1]++;
        }
        Map<Long, StationEntity> stations = stations(recent);
        sums.forEach((stationId, sum) -> {
            StationEntity station = stations.get(stationId);
            if (station == null) {
                return;
            }
            try {
                signals.sentiment(Domain.fromCode(station.getExternalId()), sum[0] / sum[1]);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring sentiment bucket {}: not a domain code", station.getExternalId());
            }
        });
    }

    private void readForecasts(LocalDateTime now, CorrelationSignals.CorrelationSignalsBuilder signals) {
        for (String code : FORECAST_INDICATORS) {
            Optional<IndicatorEntity> indicator = indicatorJpaRepository.findByCode(code);
            if (indicator.isEmpty()) {
                continue;
            }
            List<ObservationEntity> latest = latestPerStation(indicator.get(), now);
            Map<Long, StationEntity> stations = stations(latest);
            for (ObservationEntity observation : latest) {
                StationEntity station = stations.get(observation.getStationId());
                signals.forecast(ForecastReading.builder()
                        .indicatorCode(code)
                        .location(station != null ? station.getName() : "station " + observation.getStationId())
                        .value(observation.getValue())
                        .observedAt(observation.getObservedAt())
                        .build());
            }
        }
    }

    private List<ObservationEntity> latestPerStation(IndicatorEntity indicator, LocalDateTime now) {
        return observationJpaRepository.findLatestPerStation(
                indicator.getId(),
                now.minusHours(config.getSignalMaxAgeHours()),
                PageRequest.of(0, config.getMaxSignalRows()));
    }

    private Map<Long, StationEntity> stations(List<ObservationEntity> observations) {
        Set<Long> ids = new HashSet<>();
        observations.forEach(o -> {
            if (o.getStationId() != null) {
                ids.add(o.getStationId());
            }
        });
        Map<Long, StationEntity> byId = new HashMap<>();
        if (!ids.isEmpty()) {
            stationJpaRepository.findAllById(ids).forEach(s -> byId.put(s.getId(), s));
        }
        return byId;
    }

    static Optional<Double> reserveMargin(Collection<Alert> domainAlerts) {
        for (Alert alert : domainAlerts) {
            if (alert.getPayload() instanceof GridPayload grid && grid.getReserveMarginPct() != null) {
                return Optional.of(grid.getReserveMarginPct());
            }
        }
        return Optional.empty();
    }
}
