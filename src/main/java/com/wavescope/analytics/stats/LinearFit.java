package com.wavescope.analytics.stats;

/**
 * Ordinary least squares line {@code y = slope * x + intercept}.
 *
 * @param rSquared coefficient of determination, clamped to [0, 1]
 */
public record LinearFit(double slope, double intercept, double rSquared, int points) {

    public double predict(double x) {
        return slope * x + intercept;
    }

    public static LinearFit flat(double level, int points) {
        return new LinearFit(0.0, level, 0.0, points);
    }
}
