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
 * Persisted WaveScore observation. One row per (trend_id, observed_at).
 */
@Entity
@Table(name = "score_point",
       uniqueConstraints = @UniqueConstraint(name = "uk_score_point_trend_time", columnNames = {"trend_id", "observed_at"}),
       indexes = {
           @Index(name = "idx_score_point_time", columnList = "observed_at"),
           @Index(name = "idx_score_point_category", columnList = "category, observed_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScorePointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trend_id", nullable = false, length = 200)
    private String trendId;

    @Column(name = "content_id", length = 150)
    private String contentId;

    @Column(name = "observed_at", nullable = false)
    private LocalDateTime observedAt;

    @Column(name = "wave_score", nullable = false)
    private Double waveScore;

    @Column(name = "confidence", nullable = false)
    private Double confidence;

    @Column(name = "platform_source", length = 30)
    private String platformSource;

    @Column(name = "category", length = 100)
    private String category;

    // Raw metrics
    @Column(name = "views")
    private Long views;

    @Column(name = "likes")
    private Long likes;

    @Column(name = "comments")
    private Long comments;

    @Column(name = "shares")
    private Long shares;

    // Score components, null when the breakdown is unknown
    @Column(name = "views_component")
    private Double viewsComponent;

    @Column(name = "engagement_component")
    private Double engagementComponent;

    @Column(name = "growth_component")
    private Double growthComponent;

    @Column(name = "sentiment_component")
    private Double sentimentComponent;

    @Column(name = "recency_component")
    private Double recencyComponent;

    @Column(name = "viral_score")
    private Double viralScore;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
