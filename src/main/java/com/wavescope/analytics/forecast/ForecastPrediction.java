package com.wavescope.analytics.forecast;

import com.wavescope.analytics.stats.SeriesMath;

import java.time.LocalDateTime;

/**
 * Prediction for one horizon hour. All values lie in [0, 100] and
 * {@code confidenceLower <= predictedValue <= confidenceUpper}.
 */
public record ForecastPrediction(
        LocalDateTime timestamp,
        double predictedValue,
        double confidenceLower,
        double confidenceUpper,
        double confidenceLevel,
        int hoursAhead
) {

    /**
     * Clamp a raw prediction to [0, 100] and build a symmetric interval around it.
     */
    public static ForecastPrediction of(LocalDateTime timestamp, int hoursAhead, double rawPrediction,
                                        double margin, double confidenceLevel) {
        double predicted = SeriesMath.clampScore(rawPrediction);
        double halfWidth = Math.max(0.0, margin);
        return new ForecastPrediction(
                timestamp,
                predicted,
                SeriesMath.clampScore(predicted - halfWidth),
                SeriesMath.clampScore(predicted + halfWidth),
                SeriesMath.clamp(confidenceLevel, 0.0, 1.0),
                hoursAhead);
    }
}
