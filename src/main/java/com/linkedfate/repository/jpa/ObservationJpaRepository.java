package com.linkedfate.repository.jpa;

import com.linkedfate.entity.ObservationEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the observations table.
 *
 * <p>The engine only reads through this repository; inserts come from
 * {@code ObservationService}. Every list query takes a {@link Pageable} so callers always
 * bound the result size.
 */
@Repository
public interface ObservationJpaRepository extends JpaRepository<ObservationEntity, Long> {

    /**
     * Count and mean of valid observations in {@code [from, to)}. A null station or region id
     * leaves that dimension unfiltered.
     */
    @Query("SELECT new com.linkedfate.repository.jpa.BaselineAggregate(COUNT(o), AVG(o.value)) "
            + "FROM ObservationEntity o "
            + "WHERE o.indicatorId = :indicatorId "
            + "AND (:stationId IS NULL OR o.stationId = :stationId) "
            + "AND (:regionId IS NULL OR o.regionId = :regionId) "
            + "AND o.qualityFlag = :qualityFlag "
            + "AND o.observedAt >= :from AND o.observedAt < :to")
    BaselineAggregate aggregate(
            @Param("indicatorId") Long indicatorId,
            @Param("stationId") Long stationId,
            @Param("regionId") Long regionId,
            @Param("qualityFlag") String qualityFlag,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to);

    /** Sum of squared deviations from {@code mean} over the same rows as {@link #aggregate}. */
    @Query("SELECT SUM((o.value - :mean) * (o.value - :mean)) "
            + "FROM ObservationEntity o "
            + "WHERE o.indicatorId = :indicatorId "
            + "AND (:stationId IS NULL OR o.stationId = :stationId) "
            + "AND (:regionId IS NULL OR o.regionId = :regionId) "
            + "AND o.qualityFlag = :qualityFlag "
            + "AND o.observedAt >= :from AND o.observedAt < :to")
    Double sumOfSquaredDeviations(
            @Param("indicatorId") Long indicatorId,
            @Param("stationId") Long stationId,
            @Param("regionId") Long regionId,
            @Param("qualityFlag") String qualityFlag,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("mean") double mean);

    @Query("SELECT o FROM ObservationEntity o WHERE o.indicatorId = :indicatorId "
            + "AND o.qualityFlag = :qualityFlag AND o.observedAt >= :since ORDER BY o.observedAt DESC")
    List<ObservationEntity> findRecent(
            @Param("indicatorId") Long indicatorId,
            @Param("qualityFlag") String qualityFlag,
            @Param("since") LocalDateTime since,
            Pageable pageable);

    @Query("SELECT o FROM ObservationEntity o WHERE o.indicatorId = :indicatorId "
            + "AND o.observedAt >= :since ORDER BY o.observedAt DESC")
    List<ObservationEntity> findSince(
            @Param("indicatorId") Long indicatorId, @Param("since") LocalDateTime since, Pageable pageable);

    Optional<ObservationEntity> findFirstByIndicatorIdOrderByObservedAtDesc(Long indicatorId);

    /** Latest observation of an indicator for every station that reported it. */
    @Query("SELECT o FROM ObservationEntity o WHERE o.indicatorId = :indicatorId "
            + "AND o.stationId IS NOT NULL AND o.observedAt >= :since "
            + "AND o.observedAt = (SELECT MAX(o2.observedAt) FROM ObservationEntity o2 "
            + "WHERE o2.indicatorId = o.indicatorId AND o2.stationId = o.stationId) "
            + "ORDER BY o.stationId")
    List<ObservationEntity> findLatestPerStation(
            @Param("indicatorId") Long indicatorId, @Param("since") LocalDateTime since, Pageable pageable);

    @Query("SELECT COUNT(o) FROM ObservationEntity o WHERE o.indicatorId = :indicatorId "
            + "AND ((:stationId IS NULL AND o.stationId IS NULL) OR o.stationId = :stationId) "
            + "AND ((:regionId IS NULL AND o.regionId IS NULL) OR o.regionId = :regionId) "
            + "AND o.observedAt = :observedAt")
    long countByKey(
            @Param("indicatorId") Long indicatorId,
            @Param("stationId") Long stationId,
            @Param("regionId") Long regionId,
            @Param("observedAt") LocalDateTime observedAt);

    default boolean existsByKey(Long indicatorId, Long stationId, Long regionId, LocalDateTime observedAt) {
        return countByKey(indicatorId, stationId, regionId, observedAt) > 0;
    }
}
