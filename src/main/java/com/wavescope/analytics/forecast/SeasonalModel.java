package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hour-of-day averages plus a damped trend.
 */
@Component
public class SeasonalModel implements ForecastModel {

    private static final double ACCURACY = 0.5;
    private static final double DEFAULT_LEVEL = 50.0;
    private static final double TREND_DAMPING = 0.1;
    private static final double MARGIN = 10.0;

    @Override
    public ForecastModelType getType() {
        return ForecastModelType.SEASONAL;
    }

    @Override
    public Forecast forecast(TrendSeries history, int horizonHours) {
        Double[] hourly = hourlyAverages(history);
        double trend = SeriesMath.averageChange(history.waveScores());

        LocalDateTime origin = history.last().getTimestamp();
        List<ForecastPrediction> predictions = new ArrayList<>();
        for (int h = 1; h <= horizonHours; h++) {
            LocalDateTime at = origin.plusHours(h);
            Double bucket = hourly[at.getHour()];
            double seasonal = bucket != null ? bucket : DEFAULT_LEVEL;
            predictions.add(ForecastPrediction.of(at, h, seasonal + trend * h * TREND_DAMPING, MARGIN, ACCURACY));
        }

        int covered = 0;
        for (Double bucket : hourly) {
            if (bucket != null) covered++;
        }
        Map<String, Double> metadata = new LinkedHashMap<>();
        metadata.put("trend", trend);
        metadata.put("covered_hours", (double) covered);

        return Forecast.builder()
                .modelType(getType())
                .modelAccuracy(ACCURACY)
                .predictions(predictions)
                .modelMetadata(metadata)
                .build();
    }

    /**
     * Average wave score per hour of day; null for hours without history.
     */
    static Double[] hourlyAverages(TrendSeries history) {
        double[] sums = new double[24];
        int[] counts = new int[24];
        for (ScorePoint point : history.getPoints()) {
            int hour = point.getTimestamp().getHour();
            sums[hour] += point.getWaveScore();
            counts[hour]++;
        }
        Double[] averages = new Double[24];
        for (int hour = 0; hour < 24; hour++) {
            if (counts[hour] > 0) {
                averages[hour] = sums[hour] / counts[hour];
            }
        }
        return averages;
    }
}
