package com.linkedfate.api.controller;

import com.linkedfate.domain.model.Indicator;
import com.linkedfate.domain.model.Station;
import com.linkedfate.observation.ReferenceDataQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ReferenceDataController {

    private final ReferenceDataQueryService referenceDataQueryService;

    public ReferenceDataController(ReferenceDataQueryService referenceDataQueryService) {
        this.referenceDataQueryService = referenceDataQueryService;
    }

    @GetMapping("/indicators")
    public List<Indicator> getIndicators() {
        return referenceDataQueryService.listIndicators();
    }

    @GetMapping("/stations")
    public List<Station> getStations(
            @RequestParam(required = false) String stationType, @RequestParam(defaultValue = "500") int limit) {
        return referenceDataQueryService.listStations(stationType, limit);
    }
}
