package com.linkedfate.repository.jpa;

import lombok.Getter;

/** Row shape of the first baseline pass: count and mean over a window. */
@Getter
public class BaselineAggregate {

    private final long count;
    private final double mean;

    public BaselineAggregate(Long count, Double mean) {
        this.count = count != null ? count : 0L;
        this.mean = mean != null ? mean : 0.0;
    }
}
