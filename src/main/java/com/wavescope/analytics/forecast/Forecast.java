package com.wavescope.analytics.forecast;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of a single forecasting model.
 */
@Value
@Builder
public class Forecast {

    ForecastModelType modelType;

    /**
     * Self-reported accuracy 0..1, used as the ensemble weight.
     */
    double modelAccuracy;

    List<ForecastPrediction> predictions;

    // Model parameters (slope, alpha, pattern strength...), informational only
    Map<String, Double> modelMetadata;
}
