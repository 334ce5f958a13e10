package com.linkedfate.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortPayload implements AlertPayload {

    private String indicatorCode;
    private String port;
    private double vesselsWaiting;
    private Double dwellHours;
    private Double threshold;

    @Override
    public String indicatorCode() {
        return indicatorCode;
    }
}
