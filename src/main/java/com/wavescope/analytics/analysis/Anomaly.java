package com.wavescope.analytics.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A detected anomaly, keyed by (trendId, detectionTimestamp, anomalyType).
 */
@Value
@Builder
public class Anomaly {

    String trendId;
    AnomalyType anomalyType;
    AnomalySeverity severity;

    /**
     * Magnitude 0..100.
     */
    double anomalyScore;

    // Previous score for spikes and drops, series mean for patterns
    double baselineValue;
    double anomalyValue;
    double thresholdExceeded;

    /**
     * Confidence 0..1.
     */
    double confidence;

    // Advisory only
    List<String> probableCauses;

    LocalDateTime detectionTimestamp;
    int durationMinutes;
    AnomalyMetadata metadata;
}
