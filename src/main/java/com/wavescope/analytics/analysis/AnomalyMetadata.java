package com.wavescope.analytics.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Detector internals attached to an anomaly. Fields not relevant to the anomaly type are null.
 *
 * @param rate           relative change against the previous point (growth or decline)
 * @param statistical    z-score threshold was crossed
 * @param rapid          rate threshold was crossed
 * @param patternType    {@code high_volatility} or {@code oscillation} for unusual patterns
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyMetadata(
        Double zScore,
        Double rate,
        Boolean statistical,
        Boolean rapid,
        Double baselineMean,
        Double baselineStdDev,
        String patternType,
        Double volatility,
        Double oscillationRatio,
        Integer dataPoints
) {

    public static AnomalyMetadata pointChange(double zScore, double rate, boolean statistical, boolean rapid,
                                              BaselineStatistics baseline) {
        return new AnomalyMetadata(zScore, rate, statistical, rapid, baseline.mean(), baseline.stdDev(),
                null, null, null, null);
    }

    public static AnomalyMetadata volatilityPattern(double volatility, int dataPoints) {
        return new AnomalyMetadata(null, null, null, null, null, null,
                "high_volatility", volatility, null, dataPoints);
    }

    public static AnomalyMetadata oscillationPattern(double oscillationRatio, int dataPoints) {
        return new AnomalyMetadata(null, null, null, null, null, null,
                "oscillation", null, oscillationRatio, dataPoints);
    }
}
