package com.linkedfate.repository.jpa;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.entity.AlertEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alerts table.
 *
 * <p>Results are ordered by {@code levelRank} then {@code triggeredAt} so that the database
 * sort matches {@code Alert.SEVERITY_THEN_RECENCY}. "Current status" is the newest active row
 * per (alert_type, title), resolved with a correlated MAX subquery.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertEntity a SET a.active = false WHERE a.active = true AND a.triggeredAt < :cutoff")
    int deactivateTriggeredBefore(@Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT a FROM AlertEntity a WHERE "
            + "(:alertType IS NULL OR a.alertType = :alertType) "
            + "AND (:alertLevel IS NULL OR a.alertLevel = :alertLevel) "
            + "ORDER BY a.levelRank DESC, a.triggeredAt DESC, a.id DESC")
    List<AlertEntity> findFiltered(
            @Param("alertType") AlertType alertType,
            @Param("alertLevel") AlertLevel alertLevel,
            Pageable pageable);

    @Query("SELECT a FROM AlertEntity a WHERE a.active = true "
            + "AND (:alertType IS NULL OR a.alertType = :alertType) "
            + "AND (:alertLevel IS NULL OR a.alertLevel = :alertLevel) "
            + "AND a.id = (SELECT MAX(b.id) FROM AlertEntity b WHERE b.active = true "
            + "AND b.alertType = a.alertType AND b.title = a.title "
            + "AND b.triggeredAt = (SELECT MAX(c.triggeredAt) FROM AlertEntity c WHERE c.active = true "
            + "AND c.alertType = a.alertType AND c.title = a.title)) "
            + "ORDER BY a.levelRank DESC, a.triggeredAt DESC, a.id DESC")
    List<AlertEntity> findCurrentStatus(
            @Param("alertType") AlertType alertType,
            @Param("alertLevel") AlertLevel alertLevel,
            Pageable pageable);
}
