package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.LinearFit;
import com.wavescope.analytics.stats.SeriesMath;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Least squares line of wave score against hours since the first point.
 * Accuracy is the R² of the fit.
 */
@Component
public class LinearRegressionModel implements ForecastModel {

    private static final double MIN_CONFIDENCE = 0.3;
    private static final double MARGIN_FACTOR = 0.3;

    @Override
    public ForecastModelType getType() {
        return ForecastModelType.LINEAR_REGRESSION;
    }

    @Override
    public Forecast forecast(TrendSeries history, int horizonHours) {
        LinearFit fit = fit(history);
        double confidence = Math.max(MIN_CONFIDENCE, fit.rSquared());

        LocalDateTime origin = history.last().getTimestamp();
        double originX = history.hoursSinceStart(origin);

        List<ForecastPrediction> predictions = new ArrayList<>();
        for (int h = 1; h <= horizonHours; h++) {
            double predicted = SeriesMath.clampScore(fit.predict(originX + h));
            double margin = (100 - predicted) * (1 - confidence) * MARGIN_FACTOR;
            predictions.add(ForecastPrediction.of(origin.plusHours(h), h, predicted, margin, confidence));
        }

        Map<String, Double> metadata = new LinkedHashMap<>();
        metadata.put("slope", fit.slope());
        metadata.put("intercept", fit.intercept());
        metadata.put("r_squared", fit.rSquared());
        metadata.put("training_points", (double) fit.points());

        return Forecast.builder()
                .modelType(getType())
                .modelAccuracy(fit.rSquared())
                .predictions(predictions)
                .modelMetadata(metadata)
                .build();
    }

    /**
     * Fit against the time axis in hours since the first point.
     */
    public static LinearFit fit(TrendSeries series) {
        double[] x = new double[series.size()];
        double[] y = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            ScorePoint point = series.get(i);
            x[i] = series.hoursSinceStart(point.getTimestamp());
            y[i] = point.getWaveScore();
        }
        return SeriesMath.fit(x, y);
    }
}
