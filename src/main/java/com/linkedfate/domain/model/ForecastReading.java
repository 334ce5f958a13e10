package com.linkedfate.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Latest forecast value for one location (e.g. max temperature over the next 48h). */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastReading {

    private String indicatorCode;
    private String location;
    private double value;
    private LocalDateTime observedAt;
}
