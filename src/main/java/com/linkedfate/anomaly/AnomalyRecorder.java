package com.linkedfate.anomaly;

import com.linkedfate.domain.model.Anomaly;
import com.linkedfate.entity.AnomalyEntity;
import com.linkedfate.mapper.AnomalyMapper;
import com.linkedfate.repository.jpa.AnomalyJpaRepository;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a detection cycle's anomalies in one transaction, skipping any whose dedup key is
 * already stored or repeated within the batch.
 */
@Component
public class AnomalyRecorder {

    private final AnomalyJpaRepository anomalyJpaRepository;

    private final AnomalyMapper anomalyMapper = Mappers.getMapper(AnomalyMapper.class);

    public AnomalyRecorder(AnomalyJpaRepository anomalyJpaRepository) {
        this.anomalyJpaRepository = anomalyJpaRepository;
    }

    /** Returns the anomalies actually inserted. */
    @Transactional
    public List<Anomaly> saveNew(List<Anomaly> anomalies) {
        Set<List<Object>> seen = new HashSet<>();
        List<AnomalyEntity> toInsert = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            List<Object> key = Arrays.asList(
                    anomaly.getIndicatorId(), anomaly.getStationId(), anomaly.getRegionId(), anomaly.getDetectedAt());
            if (!seen.add(key)) {
                continue;
            }
            if (anomalyJpaRepository.existsByKey(
                    anomaly.getIndicatorId(), anomaly.getStationId(), anomaly.getRegionId(), anomaly.getDetectedAt())) {
                continue;
            }
            toInsert.add(anomalyMapper.toEntity(anomaly));
        }
        if (toInsert.isEmpty()) {
            return List.of();
        }
        List<AnomalyEntity> saved = anomalyJpaRepository.saveAllAndFlush(toInsert);
        return anomalyMapper.toDomainList(saved);
    }
}
