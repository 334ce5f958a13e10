package com.linkedfate.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Attached to the placeholder alert emitted when a domain could not be evaluated. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DegradedPayload implements AlertPayload {

    private String domain;
    private String reason;
}
