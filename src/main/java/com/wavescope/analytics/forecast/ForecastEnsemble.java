package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every forecasting model on a series and combines their predictions,
 * weighting each model by its own accuracy.
 */
@Component
@Slf4j
public class ForecastEnsemble {

    public static final int MIN_POINTS = 10;

    private static final double FALLBACK_WEIGHT = 0.5;

    // Warning thresholds
    private static final double EXTREME_HIGH = 95.0;
    private static final double EXTREME_LOW = 5.0;
    private static final double LOW_CONFIDENCE = 0.4;
    private static final double HIGH_VOLATILITY = 20.0;

    private final List<ForecastModel> models;

    public ForecastEnsemble(List<ForecastModel> models) {
        List<ForecastModel> ordered = new ArrayList<>(models);
        ordered.sort(Comparator.comparing(ForecastModel::getType));
        this.models = List.copyOf(ordered);
    }

    /**
     * @return empty when the series has fewer than {@value #MIN_POINTS} points or no model succeeded
     */
    public Optional<EnsembleForecast> forecast(TrendSeries history, int horizonHours) {
        if (history == null || history.size() < MIN_POINTS) {
            log.warn("Insufficient historical data for forecast: {} ({} points)",
                    history != null ? history.getTrendId() : null, history != null ? history.size() : 0);
            return Optional.empty();
        }
        if (horizonHours <= 0) {
            throw new IllegalArgumentException("horizonHours must be positive: " + horizonHours);
        }

        Map<ForecastModelType, Forecast> forecasts = new LinkedHashMap<>();
        for (ForecastModel model : models) {
            try {
                forecasts.put(model.getType(), model.forecast(history, horizonHours));
            } catch (RuntimeException e) {
                log.warn("{} forecast failed for {}: {}", model.getType(), history.getTrendId(), e.getMessage());
            }
        }

        if (forecasts.isEmpty()) {
            log.warn("No forecasts available for ensemble: {}", history.getTrendId());
            return Optional.empty();
        }

        return Optional.of(combine(history, forecasts, horizonHours));
    }

    EnsembleForecast combine(TrendSeries history, Map<ForecastModelType, Forecast> forecasts, int horizonHours) {
        Map<ForecastModelType, Double> rawWeights = new EnumMap<>(ForecastModelType.class);
        double totalWeight = 0;
        for (Forecast forecast : forecasts.values()) {
            double weight = forecast.getModelAccuracy() > 0 ? forecast.getModelAccuracy() : FALLBACK_WEIGHT;
            rawWeights.put(forecast.getModelType(), weight);
            totalWeight += weight;
        }

        Map<ForecastModelType, Double> weights = new EnumMap<>(ForecastModelType.class);
        for (Map.Entry<ForecastModelType, Double> entry : rawWeights.entrySet()) {
            weights.put(entry.getKey(), entry.getValue() / totalWeight);
        }

        List<ForecastPrediction> predictions = new ArrayList<>();
        for (int h = 1; h <= horizonHours; h++) {
            double value = 0, lower = 0, upper = 0, confidence = 0;
            for (Forecast forecast : forecasts.values()) {
                ForecastPrediction prediction = forecast.getPredictions().get(h - 1);
                double weight = weights.get(forecast.getModelType());
                value += prediction.predictedValue() * weight;
                lower += prediction.confidenceLower() * weight;
                upper += prediction.confidenceUpper() * weight;
                confidence += prediction.confidenceLevel() * weight;
            }
            predictions.add(new ForecastPrediction(
                    history.last().getTimestamp().plusHours(h),
                    SeriesMath.clampScore(SeriesMath.round2(value)),
                    SeriesMath.clampScore(SeriesMath.round2(lower)),
                    SeriesMath.clampScore(SeriesMath.round2(upper)),
                    SeriesMath.clamp(SeriesMath.round2(confidence), 0.0, 1.0),
                    h));
        }

        EnsembleForecast ensemble = EnsembleForecast.builder()
                .trendId(history.getTrendId())
                .forecastOrigin(history.last().getTimestamp())
                .modelAccuracy(SeriesMath.clamp(totalWeight / forecasts.size(), 0.0, 1.0))
                .predictions(predictions)
                .componentModels(List.copyOf(forecasts.keySet()))
                .modelWeights(weights)
                .warningFlags(warnings(predictions))
                .build();

        log.debug("Ensemble forecast for {}: models={}, accuracy={}, warnings={}",
                history.getTrendId(), ensemble.getComponentModels(), ensemble.getModelAccuracy(),
                ensemble.getWarningFlags());
        return ensemble;
    }

    /**
     * Distinct warning flags in order of first occurrence.
     */
    static List<String> warnings(List<ForecastPrediction> predictions) {
        Set<String> flags = new LinkedHashSet<>();
        double[] values = new double[predictions.size()];
        for (int i = 0; i < predictions.size(); i++) {
            ForecastPrediction p = predictions.get(i);
            values[i] = p.predictedValue();
            if (p.predictedValue() > EXTREME_HIGH) flags.add("extreme_high_prediction");
            if (p.predictedValue() < EXTREME_LOW) flags.add("extreme_low_prediction");
            if (p.confidenceLevel() < LOW_CONFIDENCE) flags.add("low_confidence");
        }
        if (SeriesMath.stdDev(values) > HIGH_VOLATILITY) {
            flags.add("high_volatility_forecast");
        }
        return List.copyOf(flags);
    }
}
