package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Standing of a trend against same-category peers.
 * Percentiles are in [0, 100]; ranking 1 means no peer scored higher.
 */
@JsonTypeName("performance_comparison")
public record PerformanceComparisonPayload(
        PeerMetrics currentTrend,
        List<PeerMetrics> peers,
        double waveScorePercentile,
        double reachPercentile,
        int waveScoreRanking,
        int reachRanking
) implements VariantPayload {
}
