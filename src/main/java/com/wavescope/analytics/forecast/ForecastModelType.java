package com.wavescope.analytics.forecast;

/**
 * Forecasting models, in ensemble combination order.
 */
public enum ForecastModelType {
    LINEAR_REGRESSION("linear_regression"),
    EXPONENTIAL_SMOOTHING("exponential_smoothing"),
    SEASONAL("seasonal"),
    PATTERN("pattern"),
    ENSEMBLE("ensemble");

    private final String code;

    ForecastModelType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
