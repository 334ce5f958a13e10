package com.linkedfate.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CYCLE_IN_PROGRESS("CYCLE_IN_PROGRESS", 409),
    CYCLE_TIMEOUT("CYCLE_TIMEOUT", 504),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE", 500),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
