package com.linkedfate.exception;

/**
 * The store rejected a cycle's writes. The whole cycle was rolled back and is safe to retry.
 */
public class PersistenceFailureException extends BaseException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
