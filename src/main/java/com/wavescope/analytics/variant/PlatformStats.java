package com.wavescope.analytics.variant;

public record PlatformStats(
        int dataPoints,
        double avgWaveScore,
        double maxWaveScore,
        double totalReach,
        double avgEngagement
) {
}
