package com.wavescope.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One scored observation of a trend. Immutable once created.
 */
@Value
@Builder(toBuilder = true)
public class ScorePoint {

    LocalDateTime timestamp;
    String trendId;
    String contentId;

    /**
     * Composite popularity score in [0, 100].
     */
    double waveScore;

    /**
     * Confidence of the score in [0, 1].
     */
    double confidence;

    String platformSource;
    String category;
    RawMetrics rawMetrics;

    // Null when the point was stored without its breakdown
    ScoreComponents components;

    // Null until viral scoring ran for this observation
    Double viralScore;

    /**
     * Reach estimate of this observation (its view count).
     */
    public long getReach() {
        return rawMetrics != null ? rawMetrics.views() : 0L;
    }

    /**
     * Engagement sub-component, 0 when no breakdown is available.
     */
    public double getEngagementScore() {
        return components != null ? components.engagement() : 0.0;
    }
}
