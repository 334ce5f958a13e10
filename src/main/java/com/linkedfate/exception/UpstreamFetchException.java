package com.linkedfate.exception;

import java.util.Map;

/** A signal source (observation store, market feed) could not be read. */
public class UpstreamFetchException extends BaseException {

    public UpstreamFetchException(String source, Throwable cause) {
        super(
                ErrorCode.UPSTREAM_UNAVAILABLE,
                String.format("Failed to read %s: %s", source, cause.getMessage()),
                Map.of("source", source),
                cause);
    }
}
