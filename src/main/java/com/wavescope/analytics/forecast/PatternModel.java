package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extrapolates the mean and trend of the most recent window of scores.
 *
 * Window size is min(10, n / 3). Pattern strength, 1 - volatility / 100 floored at 0.3,
 * serves as the model accuracy.
 */
@Component
public class PatternModel implements ForecastModel {

    private static final int MAX_WINDOW = 10;
    private static final double MIN_STRENGTH = 0.3;
    private static final double MIN_CONFIDENCE = 0.4;
    private static final double MARGIN_FACTOR = 0.4;

    record WindowFeatures(double mean, double trend, double volatility) {
    }

    @Override
    public ForecastModelType getType() {
        return ForecastModelType.PATTERN;
    }

    @Override
    public Forecast forecast(TrendSeries history, int horizonHours) {
        double[] scores = history.waveScores();
        int windowSize = Math.max(1, Math.min(MAX_WINDOW, scores.length / 3));
        List<WindowFeatures> features = extractFeatures(scores, windowSize);
        WindowFeatures last = features.get(features.size() - 1);

        double strength = patternStrength(scores);
        double confidence = Math.max(MIN_CONFIDENCE, strength);

        LocalDateTime origin = history.last().getTimestamp();
        List<ForecastPrediction> predictions = new ArrayList<>();
        for (int h = 1; h <= horizonHours; h++) {
            double predicted = SeriesMath.clampScore(last.mean() + last.trend() * h);
            double margin = (100 - predicted) * (1 - confidence) * MARGIN_FACTOR;
            predictions.add(ForecastPrediction.of(origin.plusHours(h), h, predicted, margin, confidence));
        }

        Map<String, Double> metadata = new LinkedHashMap<>();
        metadata.put("pattern_strength", strength);
        metadata.put("feature_count", (double) features.size());
        metadata.put("window_size", (double) windowSize);

        return Forecast.builder()
                .modelType(getType())
                .modelAccuracy(strength)
                .predictions(predictions)
                .modelMetadata(metadata)
                .build();
    }

    /**
     * Features of every window of the given size, the last one ending at the final score.
     */
    static List<WindowFeatures> extractFeatures(double[] scores, int windowSize) {
        List<WindowFeatures> features = new ArrayList<>();
        for (int end = windowSize; end <= scores.length; end++) {
            double[] window = Arrays.copyOfRange(scores, end - windowSize, end);
            features.add(new WindowFeatures(
                    SeriesMath.mean(window),
                    SeriesMath.averageChange(window),
                    SeriesMath.stdDev(window)));
        }
        return features;
    }

    static double patternStrength(double[] scores) {
        return Math.max(MIN_STRENGTH, 1 - SeriesMath.stdDev(scores) / 100);
    }
}
