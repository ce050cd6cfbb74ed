package com.wavescope.analytics.score;

/**
 * Per-hour growth of an observation relative to the previous one of the same trend.
 *
 * @param engagementRate    (likes + comments + shares) / views
 * @param recencyMultiplier clamp((48 - age) / 48, 0.1, 1)
 */
public record GrowthMetrics(
        double viewVelocity,
        double likeVelocity,
        double commentVelocity,
        double shareAcceleration,
        double engagementRate,
        double recencyMultiplier,
        double ageHours
) {}
