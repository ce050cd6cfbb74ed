package com.wavescope.analytics.analysis;

/**
 * Summary of the wave scores of a series window. Recomputed on demand, never persisted.
 */
public record BaselineStatistics(double mean, double stdDev, double min, double max, int count) {
}
