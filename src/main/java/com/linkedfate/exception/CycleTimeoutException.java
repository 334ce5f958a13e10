package com.linkedfate.exception;

/** A cycle exceeded its wall-clock budget and was cancelled before committing. */
public class CycleTimeoutException extends BaseException {

    public CycleTimeoutException(String job, long timeoutSeconds) {
        super(ErrorCode.CYCLE_TIMEOUT, String.format("%s cycle abandoned after %ds", job, timeoutSeconds));
    }
}
