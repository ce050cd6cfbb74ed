package com.wavescope.analytics.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One horizon hour of an ensemble forecast.
 * forecast_origin is the last observed timestamp the forecast was built from.
 */
@Entity
@Table(name = "forecast",
       uniqueConstraints = @UniqueConstraint(name = "uk_forecast_key",
               columnNames = {"trend_id", "forecast_origin", "hours_ahead"}),
       indexes = @Index(name = "idx_forecast_trend_origin", columnList = "trend_id, forecast_origin"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trend_id", nullable = false, length = 200)
    private String trendId;

    @Column(name = "forecast_origin", nullable = false)
    private LocalDateTime forecastOrigin;

    @Column(name = "hours_ahead", nullable = false)
    private Integer hoursAhead;

    @Column(name = "prediction_timestamp", nullable = false)
    private LocalDateTime predictionTimestamp;

    @Column(name = "predicted_value", nullable = false)
    private Double predictedValue;

    @Column(name = "confidence_lower", nullable = false)
    private Double confidenceLower;

    @Column(name = "confidence_upper", nullable = false)
    private Double confidenceUpper;

    @Column(name = "confidence_level", nullable = false)
    private Double confidenceLevel;

    @Column(name = "model_type", length = 30)
    private String modelType;

    @Column(name = "model_accuracy")
    private Double modelAccuracy;

    // JSON columns shared by all rows of one forecast
    @Column(name = "component_models", length = 500)
    private String componentModels;

    @Column(name = "model_weights", length = 1000)
    private String modelWeights;

    @Column(name = "warning_flags", length = 1000)
    private String warningFlags;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
