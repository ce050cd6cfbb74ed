package com.wavescope.analytics.persistence;

import com.wavescope.analytics.analysis.AnomalySeverity;
import com.wavescope.analytics.analysis.AnomalyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Persisted anomaly. Re-detection on the same point replaces the row.
 */
@Entity
@Table(name = "anomaly_detection",
       uniqueConstraints = @UniqueConstraint(name = "uk_anomaly_key",
               columnNames = {"trend_id", "detection_timestamp", "anomaly_type"}),
       indexes = @Index(name = "idx_anomaly_detected", columnList = "detection_timestamp"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trend_id", nullable = false, length = 200)
    private String trendId;

    @Column(name = "detection_timestamp", nullable = false)
    private LocalDateTime detectionTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_type", nullable = false, length = 20)
    private AnomalyType anomalyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private AnomalySeverity severity;

    @Column(name = "anomaly_score", nullable = false)
    private Double anomalyScore;

    @Column(name = "baseline_value")
    private Double baselineValue;

    @Column(name = "anomaly_value")
    private Double anomalyValue;

    @Column(name = "threshold_exceeded")
    private Double thresholdExceeded;

    @Column(name = "confidence", nullable = false)
    private Double confidence;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    /**
     * JSON array of cause tags.
     */
    @Column(name = "probable_causes", length = 2000)
    private String probableCauses;

    /**
     * JSON object with detector internals.
     */
    @Column(name = "detail_json", length = 4000)
    private String metadata;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
