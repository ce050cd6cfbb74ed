package com.wavescope.analytics.forecast;

import com.wavescope.analytics.model.TrendSeries;

/**
 * A forecasting model producing one prediction per horizon hour.
 */
public interface ForecastModel {

    ForecastModelType getType();

    /**
     * @param history      non-empty series, oldest point first
     * @param horizonHours number of hourly predictions to produce
     */
    Forecast forecast(TrendSeries history, int horizonHours);
}
