package com.linkedfate.entity;

import com.linkedfate.domain.enums.AnomalyType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the anomalies table.
 *
 * <p>The unique constraint on (indicator, station, region, detected_at) only rejects
 * duplicates whose station and region are both set, since SQL treats NULLs in a unique key as
 * distinct. Deduplication otherwise rests on the recorder's null-aware existence check, run
 * with the scheduler allowing one detection cycle at a time. The (is_acknowledged, detected_at)
 * index stands in for a partial index over unacknowledged rows.
 */
@Entity
@Table(
        name = "anomalies",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_anomaly_key",
                        columnNames = {"indicator_id", "station_id", "region_id", "detected_at"}),
        indexes = {
            @Index(name = "idx_anomaly_detected_at", columnList = "detected_at DESC"),
            @Index(name = "idx_anomaly_unacknowledged", columnList = "is_acknowledged, detected_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnomalyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "indicator_id", nullable = false)
    private Long indicatorId;

    @Column(name = "station_id")
    private Long stationId;

    @Column(name = "region_id")
    private Long regionId;

    @Column(name = "detected_at", nullable = false)
    private LocalDateTime detectedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_type", nullable = false, columnDefinition = "varchar(50)")
    private AnomalyType anomalyType;

    @Column(name = "severity", nullable = false)
    private double severity;

    @Column(name = "baseline_value")
    private double baselineValue;

    @Column(name = "observed_value")
    private double observedValue;

    @Column(name = "z_score")
    private double zscore;

    @Column(name = "is_acknowledged", nullable = false)
    private boolean acknowledged;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
