package com.linkedfate.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.linkedfate.anomaly.AnomalyQueryService;
import com.linkedfate.api.controller.AnomalyController;
import com.linkedfate.config.ApiResponseAdvice;
import com.linkedfate.domain.enums.AnomalyType;
import com.linkedfate.domain.model.AnomalyView;
import com.linkedfate.exception.GlobalExceptionHandler;
import com.linkedfate.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AnomalyControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:05:00Z"), ZoneOffset.UTC);

    private MockMvc mockMvc;

    @Mock
    private AnomalyQueryService anomalyQueryService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AnomalyController(anomalyQueryService))
                .setControllerAdvice(new ApiResponseAdvice(CLOCK), new GlobalExceptionHandler())
                .build();
    }

    private AnomalyView view(boolean acknowledged) {
        return AnomalyView.builder()
                .anomalyId(5L)
                .indicatorCode("GW_LEVEL")
                .indicatorName("Groundwater level")
                .stationName("Edwards Aquifer J-17")
                .stationExternalId("USGS-0801")
                .detectedAt(LocalDateTime.of(2026, 3, 1, 11, 0))
                .anomalyType(AnomalyType.CRITICAL_DEVIATION)
                .severity(1.0)
                .zscore(-4.0)
                .baselineValue(100.0)
                .observedValue(80.0)
                .acknowledged(acknowledged)
                .build();
    }

    @Test
    @DisplayName("GET /api/anomalies uses defaults")
    void defaults() throws Exception {
        when(anomalyQueryService.getRecentAnomalies(24, 0.0, null, 100)).thenReturn(List.of(view(false)));

        mockMvc.perform(get("/api/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].indicatorCode").value("GW_LEVEL"))
                .andExpect(jsonPath("$.data[0].zScore").value(-4.0))
                .andExpect(jsonPath("$.data[0].anomalyType").value("critical_deviation"));
    }

    @Test
    @DisplayName("GET /api/anomalies passes filters through")
    void filters() throws Exception {
        when(anomalyQueryService.getRecentAnomalies(6, 0.5, "GW_LEVEL", 20)).thenReturn(List.of());

        mockMvc.perform(get("/api/anomalies")
                        .param("hours", "6")
                        .param("minSeverity", "0.5")
                        .param("indicatorCode", "GW_LEVEL")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("invalid window is a validation error")
    void invalidHours() throws Exception {
        when(anomalyQueryService.getRecentAnomalies(0, 0.0, null, 100))
                .thenThrow(new ValidationException("hours must be positive"));

        mockMvc.perform(get("/api/anomalies").param("hours", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("hours must be positive"));
    }

    @Test
    @DisplayName("POST /api/anomalies/{id}/acknowledge")
    void acknowledge() throws Exception {
        when(anomalyQueryService.acknowledge(5L)).thenReturn(view(true));

        mockMvc.perform(post("/api/anomalies/5/acknowledge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.anomalyId").value(5))
                .andExpect(jsonPath("$.data.acknowledged").value(true));
    }
}
