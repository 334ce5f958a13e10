package com.linkedfate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Reference data for a measurement point. For market and sentiment indicators the external id
 * is the ticker symbol or the domain code the reading belongs to.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Station {

    private Long id;
    private String externalId;
    private String name;
    private String stationType;
    private Long regionId;
}
