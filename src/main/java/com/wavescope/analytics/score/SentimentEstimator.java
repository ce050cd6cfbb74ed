package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawMetrics;

/**
 * Produces the sentiment sub-component of a WaveScore in [0, 100].
 * Implementations must be deterministic for identical metrics.
 */
public interface SentimentEstimator {

    double estimate(RawMetrics metrics);
}
