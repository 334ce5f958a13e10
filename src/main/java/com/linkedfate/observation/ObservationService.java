package com.linkedfate.observation;

import com.linkedfate.domain.enums.QualityFlag;
import com.linkedfate.domain.model.Observation;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.ObservationEntity;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.mapper.ObservationMapper;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.ObservationJpaRepository;
import com.linkedfate.repository.jpa.RegionJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Single write path into the observation store, used by ingestors and the port simulator.
 *
 * <p>Observations are immutable: writing the same (indicator, station, region, observed_at)
 * key again is a no-op; the stored row is kept even if the value differs.
 */
@Service
public class ObservationService {

    private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

    private final IndicatorJpaRepository indicatorJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final RegionJpaRepository regionJpaRepository;
    private final ObservationJpaRepository observationJpaRepository;
    private final Clock clock;

    private final ObservationMapper observationMapper = Mappers.getMapper(ObservationMapper.class);

    public ObservationService(
            IndicatorJpaRepository indicatorJpaRepository,
            StationJpaRepository stationJpaRepository,
            RegionJpaRepository regionJpaRepository,
            ObservationJpaRepository observationJpaRepository,
            Clock clock) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.regionJpaRepository = regionJpaRepository;
        this.observationJpaRepository = observationJpaRepository;
        this.clock = clock;
    }

    /**
     * Resolves the codes and stores the reading.
     *
     * @throws ResourceNotFoundException for an unknown indicator, station or region code
     * @throws ValidationException for a non-finite value or an unknown quality flag
     */
    public ObservationWriteResult putObservation(
            String indicatorCode,
            String stationExternalId,
            String regionCode,
            LocalDateTime observedAt,
            double value,
            String qualityFlag) {
        if (observedAt == null) {
            throw new ValidationException("observedAt is required");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("value must be a finite number, got " + value);
        }
        QualityFlag flag;
        try {
            flag = QualityFlag.fromCode(qualityFlag);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        IndicatorEntity indicator = indicatorJpaRepository
                .findByCode(indicatorCode)
                .orElseThrow(() -> new ResourceNotFoundException("Indicator", indicatorCode));
        Long stationId = isBlank(stationExternalId)
                ? null
                : stationJpaRepository
                        .findByExternalId(stationExternalId)
                        .orElseThrow(() -> new ResourceNotFoundException("Station", stationExternalId))
                        .getId();
        Long regionId = isBlank(regionCode)
                ? null
                : regionJpaRepository
                        .findByCode(regionCode)
                        .orElseThrow(() -> new ResourceNotFoundException("Region", regionCode))
                        .getId();

        Observation observation = Observation.builder()
                .indicatorId(indicator.getId())
                .stationId(stationId)
                .regionId(regionId)
                .observedAt(observedAt)
                .value(value)
                .qualityFlag(flag.getCode())
                .build();

        if (observationJpaRepository.existsByKey(indicator.getId(), stationId, regionId, observedAt)) {
            log.debug("Duplicate observation ignored: {} station={} region={} at {}",
                    indicatorCode, stationExternalId, regionCode, observedAt);
            return new ObservationWriteResult(observation, false);
        }

        ObservationEntity entity = observationMapper.toEntity(observation);
        entity.setIngestedAt(LocalDateTime.now(clock));
        try {
            ObservationEntity saved = observationJpaRepository.saveAndFlush(entity);
            return new ObservationWriteResult(observationMapper.toDomain(saved), true);
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race on the unique key; the other writer's row stands.
            log.debug("Concurrent duplicate observation ignored: {} at {}", indicatorCode, observedAt);
            return new ObservationWriteResult(observation, false);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
