package com.linkedfate.observation;

import com.linkedfate.domain.model.Observation;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** The stored observation and whether this call inserted it or found it already present. */
@Getter
@AllArgsConstructor
public class ObservationWriteResult {

    private final Observation observation;
    private final boolean inserted;
}
