package com.linkedfate.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the observations table.
 *
 * <p>Append-only: written by ingestors through {@code ObservationService}, read by the anomaly
 * detector and the evaluators. The two composite indexes serve the range scans by indicator
 * and by station.
 */
@Entity
@Table(
        name = "observations",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_observation_key",
                        columnNames = {"indicator_id", "station_id", "region_id", "observed_at"}),
        indexes = {
            @Index(name = "idx_observation_indicator_time", columnList = "indicator_id, observed_at"),
            @Index(name = "idx_observation_station_time", columnList = "station_id, observed_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "indicator_id", nullable = false)
    private Long indicatorId;

    @Column(name = "station_id")
    private Long stationId;

    @Column(name = "region_id")
    private Long regionId;

    @Column(name = "observed_at", nullable = false)
    private LocalDateTime observedAt;

    @Column(name = "obs_value", nullable = false)
    private double value;

    @Column(name = "quality_flag", length = 20)
    private String qualityFlag;

    @Column(name = "ingested_at")
    private LocalDateTime ingestedAt;
}
