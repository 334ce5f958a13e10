package com.linkedfate.alert;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.enums.AlertType;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.entity.AlertEntity;
import com.linkedfate.exception.ResourceNotFoundException;
import com.linkedfate.exception.ValidationException;
import com.linkedfate.mapper.AlertMapper;
import com.linkedfate.repository.jpa.AlertJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the alert lifecycle: append-only inserts per cycle, TTL expiry, acknowledgment and the
 * severity-ordered read side.
 *
 * <p>Rows are never updated in place except for {@code active} (expiry) and the acknowledgment
 * flags. "Current status" is resolved at read time as the newest active row per
 * (alert_type, title), so an older row for the same key is superseded without being touched.
 */
@Service
@EnableConfigurationProperties(RiskEngineConfig.class)
public class AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    private final AlertJpaRepository alertJpaRepository;
    private final RiskEngineConfig riskEngineConfig;
    private final Clock clock;

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public AlertStore(AlertJpaRepository alertJpaRepository, RiskEngineConfig riskEngineConfig, Clock clock) {
        this.alertJpaRepository = alertJpaRepository;
        this.riskEngineConfig = riskEngineConfig;
        this.clock = clock;
    }

    /**
     * Deactivates alerts older than the TTL, then inserts the cycle's alerts as active, all in one
     * transaction. Returns the inserted alerts with their ids, in input order.
     */
    @Transactional
    public PersistedCycle persistCycle(List<Alert> alerts) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(riskEngineConfig.getAlertTtlMinutes());
        int deactivated = alertJpaRepository.deactivateTriggeredBefore(cutoff);
        if (deactivated > 0) {
            log.info("Deactivated {} alerts triggered before {}", deactivated, cutoff);
        }
        List<AlertEntity> entities = alertMapper.toEntityList(alerts);
        entities.forEach(entity -> {
            entity.setActive(true);
            entity.setAcknowledged(false);
            entity.setAcknowledgedAt(null);
        });
        List<AlertEntity> saved = alertJpaRepository.saveAllAndFlush(entities);
        return new PersistedCycle(alertMapper.toDomainList(saved), deactivated);
    }

    /**
     * One-way: sets {@code acknowledged} and stamps {@code acknowledgedAt} on the first call only.
     * Does not touch {@code active}.
     */
    @Transactional
    public Alert acknowledge(Long alertId) {
        AlertEntity alert = alertJpaRepository
                .findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        if (!alert.isAcknowledged()) {
            alert.setAcknowledged(true);
            alert.setAcknowledgedAt(LocalDateTime.now(clock));
            alert = alertJpaRepository.save(alert);
            log.info("Alert {} ({}) acknowledged", alertId, alert.getCode());
        }
        return alertMapper.toDomain(alert);
    }

    /**
     * Alerts sorted by severity, then recency. With {@code activeOnly} only the current status
     * row of each (alert_type, title) is returned.
     *
     * @param limit null for the configured default
     */
    @Transactional(readOnly = true)
    public List<Alert> query(boolean activeOnly, AlertType alertType, AlertLevel alertLevel, Integer limit) {
        int size = limit != null ? limit : riskEngineConfig.getDefaultQueryLimit();
        if (size <= 0 || size > riskEngineConfig.getMaxQueryLimit()) {
            throw new ValidationException("limit must be within [1, " + riskEngineConfig.getMaxQueryLimit() + "]");
        }
        PageRequest page = PageRequest.of(0, size);
        List<AlertEntity> rows = activeOnly
                ? alertJpaRepository.findCurrentStatus(alertType, alertLevel, page)
                : alertJpaRepository.findFiltered(alertType, alertLevel, page);
        return alertMapper.toDomainList(rows);
    }

    /** Newest active alert per (alert_type, title), most severe first. */
    @Transactional(readOnly = true)
    public List<Alert> currentStatus() {
        return query(true, null, null, riskEngineConfig.getMaxQueryLimit());
    }

    /** Alerts inserted by one cycle plus the number of rows expired before the insert. */
    @Getter
    @AllArgsConstructor
    public static class PersistedCycle {
        private final List<Alert> alerts;
        private final int deactivated;
    }
}
