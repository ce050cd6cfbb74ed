package com.wavescope.analytics.variant;

/**
 * Direction and dynamics of the wave score inside an aggregation window.
 *
 * @param velocity     score change per hour over the window
 * @param acceleration average second difference of the scores
 */
public record TrendAnalysis(
        String direction,
        double velocity,
        double acceleration,
        double volatility,
        double momentumScore,
        double slope,
        double rSquared
) {
}
