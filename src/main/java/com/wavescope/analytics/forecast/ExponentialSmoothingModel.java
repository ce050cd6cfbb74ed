package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple exponential smoothing with a linear trend taken from the smoothed values.
 */
@Component
public class ExponentialSmoothingModel implements ForecastModel {

    static final double ALPHA = 0.3;
    private static final double ACCURACY = 0.6;
    private static final double MARGIN_FACTOR = 0.5;

    @Override
    public ForecastModelType getType() {
        return ForecastModelType.EXPONENTIAL_SMOOTHING;
    }

    @Override
    public Forecast forecast(TrendSeries history, int horizonHours) {
        double[] smoothed = smooth(history.waveScores());
        double trend = SeriesMath.averageChange(smoothed);
        double lastSmoothed = smoothed[smoothed.length - 1];

        LocalDateTime origin = history.last().getTimestamp();
        List<ForecastPrediction> predictions = new ArrayList<>();
        for (int h = 1; h <= horizonHours; h++) {
            double margin = Math.abs(trend) * h * MARGIN_FACTOR;
            predictions.add(ForecastPrediction.of(origin.plusHours(h), h, lastSmoothed + trend * h, margin, ACCURACY));
        }

        Map<String, Double> metadata = new LinkedHashMap<>();
        metadata.put("alpha", ALPHA);
        metadata.put("trend", trend);
        metadata.put("last_smoothed", lastSmoothed);

        return Forecast.builder()
                .modelType(getType())
                .modelAccuracy(ACCURACY)
                .predictions(predictions)
                .modelMetadata(metadata)
                .build();
    }

    static double[] smooth(double[] scores) {
        double[] smoothed = new double[scores.length];
        if (scores.length == 0) {
            return smoothed;
        }
        smoothed[0] = scores[0];
        for (int i = 1; i < scores.length; i++) {
            smoothed[i] = ALPHA * scores[i] + (1 - ALPHA) * smoothed[i - 1];
        }
        return smoothed;
    }
}
