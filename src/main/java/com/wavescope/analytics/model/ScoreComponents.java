package com.wavescope.analytics.model;

/**
 * The five WaveScore sub-components, each already clamped to [0, 100].
 */
public record ScoreComponents(
        double views,
        double engagement,
        double growth,
        double sentiment,
        double recency
) {}
