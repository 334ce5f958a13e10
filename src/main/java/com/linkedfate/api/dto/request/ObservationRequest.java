package com.linkedfate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Observation write from an ingestor. Station and region are referenced by their external
 * codes; {@code qualityFlag} defaults to "valid".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationRequest {

    @NotBlank
    private String indicatorCode;

    private String stationExternalId;
    private String regionCode;

    @NotNull
    private LocalDateTime observedAt;

    @NotNull
    private Double value;

    private String qualityFlag;
}
