package com.linkedfate.repository.jpa;

import com.linkedfate.entity.AnomalyEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the anomalies table. Null-safe key comparison in {@link #countByKey}
 * mirrors the dedup key (indicator, station, region, detected_at).
 */
@Repository
public interface AnomalyJpaRepository extends JpaRepository<AnomalyEntity, Long> {

    @Query("SELECT COUNT(a) FROM AnomalyEntity a WHERE a.indicatorId = :indicatorId "
            + "AND ((:stationId IS NULL AND a.stationId IS NULL) OR a.stationId = :stationId) "
            + "AND ((:regionId IS NULL AND a.regionId IS NULL) OR a.regionId = :regionId) "
            + "AND a.detectedAt = :detectedAt")
    long countByKey(
            @Param("indicatorId") Long indicatorId,
            @Param("stationId") Long stationId,
            @Param("regionId") Long regionId,
            @Param("detectedAt") LocalDateTime detectedAt);

    default boolean existsByKey(Long indicatorId, Long stationId, Long regionId, LocalDateTime detectedAt) {
        return countByKey(indicatorId, stationId, regionId, detectedAt) > 0;
    }

    @Query("SELECT COUNT(a) FROM AnomalyEntity a WHERE a.indicatorId = :indicatorId "
            + "AND a.detectedAt >= :since AND a.acknowledged = false AND a.severity >= :minSeverity")
    long countUnacknowledged(
            @Param("indicatorId") Long indicatorId,
            @Param("since") LocalDateTime since,
            @Param("minSeverity") double minSeverity);

    @Query("SELECT a FROM AnomalyEntity a WHERE a.detectedAt >= :since AND a.severity >= :minSeverity "
            + "AND (:indicatorId IS NULL OR a.indicatorId = :indicatorId) "
            + "ORDER BY a.severity DESC, a.detectedAt DESC")
    List<AnomalyEntity> findRecent(
            @Param("since") LocalDateTime since,
            @Param("minSeverity") double minSeverity,
            @Param("indicatorId") Long indicatorId,
            Pageable pageable);
}
