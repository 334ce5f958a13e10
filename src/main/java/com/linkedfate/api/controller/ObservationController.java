package com.linkedfate.api.controller;

import com.linkedfate.api.dto.request.ObservationRequest;
import com.linkedfate.domain.model.Observation;
import com.linkedfate.domain.model.ObservationView;
import com.linkedfate.observation.ObservationService;
import com.linkedfate.observation.ObservationWriteResult;
import com.linkedfate.observation.ReferenceDataQueryService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Write endpoint for ingestors, plus a read-back of recent readings per indicator.
 */
@RestController
@RequestMapping("/api/observations")
public class ObservationController {

    private final ObservationService observationService;
    private final ReferenceDataQueryService referenceDataQueryService;

    public ObservationController(
            ObservationService observationService, ReferenceDataQueryService referenceDataQueryService) {
        this.observationService = observationService;
        this.referenceDataQueryService = referenceDataQueryService;
    }

    /** 201 with the stored observation, or 200 with the submitted reading when the key already exists. */
    @PostMapping
    public ResponseEntity<Observation> putObservation(@RequestBody @Valid ObservationRequest request) {
        ObservationWriteResult result = observationService.putObservation(
                request.getIndicatorCode(),
                request.getStationExternalId(),
                request.getRegionCode(),
                request.getObservedAt(),
                request.getValue(),
                request.getQualityFlag());
        return ResponseEntity.status(result.isInserted() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(result.getObservation());
    }

    /** Readings of {@code indicatorCode} from the last {@code hours}, newest first. */
    @GetMapping
    public List<ObservationView> getObservations(
            @RequestParam String indicatorCode,
            @RequestParam(defaultValue = "24") int hours,
            @RequestParam(defaultValue = "500") int limit) {
        return referenceDataQueryService.getRecentObservations(indicatorCode, hours, limit);
    }
}
