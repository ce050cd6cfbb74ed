package com.wavescope.analytics.forecast;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Accuracy-weighted combination of the models that produced a forecast.
 */
@Value
@Builder
public class EnsembleForecast {

    String trendId;

    /**
     * Timestamp of the last observed point; predictions are relative to it.
     */
    LocalDateTime forecastOrigin;

    double modelAccuracy;
    List<ForecastPrediction> predictions;
    List<ForecastModelType> componentModels;

    // Normalized, sums to 1
    Map<ForecastModelType, Double> modelWeights;

    List<String> warningFlags;

    public ForecastModelType getModelType() {
        return ForecastModelType.ENSEMBLE;
    }
}
