package com.linkedfate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Indicator {

    private Long id;
    private String code;
    private String name;
    private String category;
    private String unit;

    /** Function code of the owning domain (GRID, WATR, FLOW, ...). */
    private String functionCode;
}
