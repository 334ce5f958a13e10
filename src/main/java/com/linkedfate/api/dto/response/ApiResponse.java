package com.linkedfate.api.dto.response;

import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope for {@code /api} responses. {@code count} is set only when the payload is a
 * collection, so list endpoints report their size without callers walking the array.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.success = true;
        this.data = data;
        this.count = data instanceof Collection<?> collection ? collection.size() : null;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, Instant timestamp) {
        return new ApiResponse<>(data, timestamp);
    }
}
