package com.wavescope.analytics.service;

/**
 * Counts of one batch run.
 *
 * @param trendsSkipped trends without enough points for analysis
 * @param forecastRows  stored forecast rows (one per horizon hour)
 */
public record BatchSummary(
        int trendsProcessed,
        int trendsSkipped,
        int trendsFailed,
        int anomalies,
        int forecastRows,
        int variants,
        long elapsedMs
) {

    public static BatchSummary empty(long elapsedMs) {
        return new BatchSummary(0, 0, 0, 0, 0, 0, elapsedMs);
    }
}
