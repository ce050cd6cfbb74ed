package com.wavescope.analytics.service;

import com.wavescope.analytics.BaseIntegrationTest;
import com.wavescope.analytics.TestSeries;
import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.persistence.ForecastRepository;
import com.wavescope.analytics.persistence.ScorePointRepository;
import com.wavescope.analytics.persistence.TrendStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.Optional;

import static com.wavescope.analytics.TestSeries.START;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for ForecastService.
 */
@DisplayName("ForecastService Tests")
class ForecastServiceTest extends BaseIntegrationTest {

    @Autowired
    private ForecastService forecastService;

    @Autowired
    private TrendStore trendStore;

    @Autowired
    private ScorePointRepository scorePointRepository;

    @Autowired
    private ForecastRepository forecastRepository;

    @BeforeEach
    void setUp() {
        forecastRepository.deleteAll();
        scorePointRepository.deleteAll();
    }

    @Test
    @DisplayName("Forecast is generated from stored history and persisted")
    void forecastPersisted() {
        // Given
        TestSeries.hourly("youtube_a", 50, 52, 54, 56, 58, 60, 62, 64, 66, 68)
                .getPoints().forEach(trendStore::upsertScorePoint);
        LocalDateTime now = START.plusHours(9);

        // When
        Optional<EnsembleForecast> forecast = forecastService.generateForecast("youtube_a", 12, now);

        // Then
        assertThat(forecast).isPresent();
        assertThat(forecast.get().getPredictions()).hasSize(12);
        assertThat(forecastRepository.count()).isEqualTo(12);
        assertThat(forecastService.getLatestForecast("youtube_a")).isEqualTo(forecast);
    }

    @Test
    @DisplayName("Short history produces no forecast and no rows")
    void shortHistory() {
        TestSeries.hourly("youtube_a", 50, 60, 70).getPoints().forEach(trendStore::upsertScorePoint);

        Optional<EnsembleForecast> forecast = forecastService.generateForecast("youtube_a", 24, START.plusHours(2));

        assertThat(forecast).isEmpty();
        assertThat(forecastRepository.count()).isZero();
    }

    @Test
    @DisplayName("History outside the look-back window is ignored")
    void historyOutsideWindow() {
        TestSeries.hourly("youtube_a", 50, 52, 54, 56, 58, 60, 62, 64, 66, 68)
                .getPoints().forEach(trendStore::upsertScorePoint);

        assertThat(forecastService.generateForecast("youtube_a", 6, START.plusDays(30))).isEmpty();
    }
}
