package com.wavescope.analytics.stats;

/**
 * Numeric helpers shared by the analytics components.
 * All standard deviations are population standard deviations.
 */
public final class SeriesMath {

    private static final double EPSILON = 1e-12;

    private SeriesMath() {
    }

    public static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) total += v;
        return total;
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        return sum(values) / values.length;
    }

    public static double stdDev(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    public static double max(double[] values) {
        if (values.length == 0) return 0.0;
        double max = values[0];
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    public static double min(double[] values) {
        if (values.length == 0) return 0.0;
        double min = values[0];
        for (double v : values) min = Math.min(min, v);
        return min;
    }

    /**
     * Average change per element: {@code (last - first) / n}.
     */
    public static double averageChange(double[] values) {
        if (values.length < 2) return 0.0;
        return (values[values.length - 1] - values[0]) / values.length;
    }

    /**
     * OLS slope of the values against their index.
     */
    public static double indexSlope(double[] values) {
        return fitByIndex(values).slope();
    }

    public static LinearFit fitByIndex(double[] values) {
        double[] x = new double[values.length];
        for (int i = 0; i < x.length; i++) x[i] = i;
        return fit(x, values);
    }

    /**
     * Ordinary least squares fit of y against x.
     * Degenerate inputs (fewer than two points, zero x-variance) yield a flat line at the mean.
     */
    public static LinearFit fit(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n == 0) return LinearFit.flat(0.0, 0);
        if (n < 2) return LinearFit.flat(y[0], n);

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumXX += x[i] * x[i];
        }

        double denominator = n * sumXX - sumX * sumX;
        if (Math.abs(denominator) < EPSILON) {
            return LinearFit.flat(sumY / n, n);
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double ssTotal = 0, ssResidual = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * x[i] + intercept;
            ssTotal += (y[i] - yMean) * (y[i] - yMean);
            ssResidual += (y[i] - predicted) * (y[i] - predicted);
        }

        double rSquared;
        if (ssTotal < EPSILON) {
            // Constant series: perfect fit unless residuals say otherwise
            rSquared = ssResidual < EPSILON ? 1.0 : 0.0;
        } else {
            rSquared = clamp(1.0 - ssResidual / ssTotal, 0.0, 1.0);
        }

        return new LinearFit(slope, intercept, rSquared, n);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    public static double clampScore(double value) {
        return clamp(value, 0.0, 100.0);
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
