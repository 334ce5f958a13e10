package com.linkedfate.observation;

import com.linkedfate.domain.model.Indicator;
import com.linkedfate.domain.model.ObservationView;
import com.linkedfate.domain.model.Station;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.entity.StationEntity;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.mapper.ReferenceDataMapper;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.mapstruct.factory.Mappers;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only listings of the lookup tables and of raw observations, for dashboards and for
 * checking what ingestors have written.
 */
@Service
public class ReferenceDataQueryService {

    static final int MAX_LIMIT = 5000;

    private final IndicatorJpaRepository indicatorJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final ObservationJpaRepository observationJpaRepository;
    private final Clock clock;
    private final ReferenceDataMapper referenceDataMapper = Mappers.getMapper(ReferenceDataMapper.class);

    public ReferenceDataQueryService(
            IndicatorJpaRepository indicatorJpaRepository,
            StationJpaRepository stationJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            Clock clock) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.observationJpaRepository = observationJpaRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Indicator> listIndicators() {
        return referenceDataMapper.toIndicators(indicatorJpaRepository.findAll(Sort.by("code")));
    }

    /** Stations ordered by external id, optionally of one {@code stationType}. */
    @Transactional(readOnly = true)
    public List<Station> listStations(String stationType, int limit) {
        checkLimit(limit);
        PageRequest page = PageRequest.of(0, limit, Sort.by("externalId"));
        List<StationEntity> stations = stationType == null || stationType.isBlank()
                ? stationJpaRepository.findAll(page).getContent()
                : stationJpaRepository.findByStationType(stationType, page);
        return referenceDataMapper.toStations(stations);
    }

    /**
     * Readings of one indicator from the last {@code hours}, newest first, whatever their
     * quality flag.
     *
     * @throws ResourceNotFoundException if the indicator code is unknown
     */
    @Transactional(readOnly = true)
    public List<ObservationView> getRecentObservations(String indicatorCode, int hours, int limit) {
        if (hours <= 0) {
            throw new ValidationException("hours must be positive");
        }
        checkLimit(limit);
        IndicatorEntity indicator = indicatorJpaRepository
                .findByCode(indicatorCode)
                .orElseThrow(() -> new ResourceNotFoundException("Indicator", indicatorCode));

        LocalDateTime since = LocalDateTime.now(clock).minusHours(hours);
        List<ObservationEntity> observations =
                observationJpaRepository.findSince(indicator.getId(), since, PageRequest.of(0, limit));
        if (observations.isEmpty()) {
            return List.of();
        }

        Set<Long> stationIds = observations.stream()
                .map(ObservationEntity::getStationId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<Long, StationEntity> stations = stationJpaRepository.findAllById(stationIds).stream()
                .collect(Collectors.toMap(StationEntity::getId, Function.identity()));

        return observations.stream()
                .map(observation -> {
                    StationEntity station =
                            observation.getStationId() != null ? stations.get(observation.getStationId()) : null;
                    return ObservationView.builder()
                            .observationId(observation.getId())
                            .indicatorCode(indicator.getCode())
                            .stationExternalId(station != null ? station.getExternalId() : null)
                            .stationName(station != null ? station.getName() : null)
                            .value(observation.getValue())
                            .unit(indicator.getUnit())
                            .observedAt(observation.getObservedAt())
                            .qualityFlag(observation.getQualityFlag())
                            .build();
                })
                .toList();
    }

    private static void checkLimit(int limit) {
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be within [1, " + MAX_LIMIT + "]");
        }
    }
}
