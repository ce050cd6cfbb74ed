package com.wavescope.analytics.variant;

/**
 * @param trend OLS slope of the values against their index
 */
public record MetricSummary(double avg, double max, double min, double stdDev, double total, double trend) {
}
