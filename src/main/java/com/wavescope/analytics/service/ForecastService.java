package com.wavescope.analytics.service;

import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.forecast.ForecastEnsemble;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.persistence.TrendStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Generates and stores ensemble forecasts from the recent history of a trend.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastEnsemble forecastEnsemble;
    private final TrendStore trendStore;
    private final Clock clock;

    @Value("${analytics.forecast.history-days:7}")
    private int historyDays;

    public Optional<EnsembleForecast> generateForecast(String trendId, int horizonHours) {
        return generateForecast(trendId, horizonHours, LocalDateTime.now(clock));
    }

    /**
     * Forecast from the trailing history window ending at {@code now}.
     *
     * @return empty when the history is too short; nothing is stored then
     */
    public Optional<EnsembleForecast> generateForecast(String trendId, int horizonHours, LocalDateTime now) {
        log.info("Generating forecast for {} ({}h ahead)", trendId, horizonHours);
        TrendSeries history = trendStore.querySeries(trendId, now.minusDays(historyDays), now);
        return forecastSeries(history, horizonHours);
    }

    public Optional<EnsembleForecast> forecastSeries(TrendSeries history, int horizonHours) {
        Optional<EnsembleForecast> forecast = forecastEnsemble.forecast(history, horizonHours);
        forecast.ifPresent(trendStore::upsertForecast);
        return forecast;
    }

    public Optional<EnsembleForecast> getLatestForecast(String trendId) {
        return trendStore.findLatestForecast(trendId);
    }
}
