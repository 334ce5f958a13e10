package com.linkedfate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Region {

    private Long id;
    private String code;
    private String name;
    private String regionType;
}
