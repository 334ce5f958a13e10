package com.linkedfate.exception;

public class CycleInProgressException extends BaseException {

    public CycleInProgressException(String job) {
        super(ErrorCode.CYCLE_IN_PROGRESS, String.format("A %s cycle is already running", job));
    }
}
