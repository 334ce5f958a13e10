package com.linkedfate.evaluator;

import com.linkedfate.domain.enums.AlertLevel;
import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.AlertPayload;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.exception.UpstreamFetchException;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;

/** Shared alert construction and guarded store reads for the domain evaluators. */
public abstract class AbstractDomainEvaluator implements DomainEvaluator {

    protected final IndicatorJpaRepository indicatorJpaRepository;
    protected final Clock clock;
    private final String regionCode;

    protected AbstractDomainEvaluator(IndicatorJpaRepository indicatorJpaRepository, Clock clock, String regionCode) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.clock = clock;
        this.regionCode = regionCode;
    }

    protected Alert newAlert(AlertLevel level, String code, String message, AlertPayload payload) {
        return Alert.builder()
                .alertType(domain().getAlertType())
                .alertLevel(level)
                .code(code)
                .title(Alert.titleFromCode(code))
                .message(message)
                .payload(payload)
                .regionCode(regionCode)
                .triggeredAt(LocalDateTime.now(clock))
                .build();
    }

    protected Optional<IndicatorEntity> indicator(String code) {
        return read("indicator " + code, () -> indicatorJpaRepository.findByCode(code));
    }

    /** Runs a store read, translating data-access failures into {@link UpstreamFetchException}. */
    protected <T> T read(String source, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new UpstreamFetchException(source, e);
        }
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
