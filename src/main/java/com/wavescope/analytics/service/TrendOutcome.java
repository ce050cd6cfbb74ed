package com.wavescope.analytics.service;

/**
 * Result of deriving the artifacts of one trend.
 */
public record TrendOutcome(
        String trendId,
        Status status,
        int attempts,
        int anomalies,
        int forecastRows,
        int variants
) {

    public enum Status {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    static TrendOutcome skipped(String trendId) {
        return new TrendOutcome(trendId, Status.SKIPPED, 1, 0, 0, 0);
    }

    static TrendOutcome failed(String trendId, int attempts) {
        return new TrendOutcome(trendId, Status.FAILED, attempts, 0, 0, 0);
    }
}
