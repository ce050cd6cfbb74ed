package com.wavescope.analytics.service;

import com.wavescope.analytics.BaseIntegrationTest;
import com.wavescope.analytics.TestSeries;
import com.wavescope.analytics.persistence.AnomalyRepository;
import com.wavescope.analytics.persistence.ForecastRepository;
import com.wavescope.analytics.persistence.ScorePointRepository;
import com.wavescope.analytics.persistence.TrendStore;
import com.wavescope.analytics.persistence.VariantRepository;
import com.wavescope.analytics.scheduler.AnalyticsScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;

import static com.wavescope.analytics.TestSeries.START;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the batch runner.
 */
@DisplayName("TrendAnalyticsRunner Tests")
class TrendAnalyticsRunnerTest extends BaseIntegrationTest {

    private static final LocalDateTime NOW = START.plusHours(9);

    @Autowired
    private TrendAnalyticsRunner runner;

    @Autowired
    private AnalyticsScheduler scheduler;

    @Autowired
    private TrendStore trendStore;

    @Autowired
    private ScorePointRepository scorePointRepository;

    @Autowired
    private AnomalyRepository anomalyRepository;

    @Autowired
    private ForecastRepository forecastRepository;

    @Autowired
    private VariantRepository variantRepository;

    @BeforeEach
    void setUp() {
        variantRepository.deleteAll();
        forecastRepository.deleteAll();
        anomalyRepository.deleteAll();
        scorePointRepository.deleteAll();
    }

    @Test
    @DisplayName("Trends with enough data are processed and short ones skipped")
    void processesAndSkips() {
        // Given: ten hourly points for one trend, three for another
        TestSeries.hourly("youtube_a", 50, 50, 50, 95, 50, 52, 54, 56, 58, 60)
                .getPoints().forEach(trendStore::upsertScorePoint);
        TestSeries.hourlyPoints("youtube_b", START.plusHours(7), 40, 42, 44)
                .forEach(trendStore::upsertScorePoint);

        // When
        BatchSummary summary = runner.runBatch(NOW);

        // Then
        assertThat(summary.trendsProcessed()).isEqualTo(1);
        assertThat(summary.trendsSkipped()).isEqualTo(1);
        assertThat(summary.trendsFailed()).isZero();
        assertThat(summary.anomalies()).isPositive();
        assertThat(summary.forecastRows()).isEqualTo(24);
        assertThat(summary.variants()).isPositive();

        assertThat(trendStore.findAnomalies("youtube_b")).isEmpty();
        assertThat(trendStore.findLatestForecast("youtube_b")).isEmpty();
        assertThat(trendStore.findVariants("youtube_b")).isEmpty();
        assertThat(trendStore.findLatestForecast("youtube_a")).isPresent();
    }

    @Test
    @DisplayName("Re-running the batch leaves the stored artifacts unchanged")
    void rerunIdempotent() {
        TestSeries.hourly("youtube_a", 50, 50, 50, 95, 50, 52, 54, 56, 58, 60)
                .getPoints().forEach(trendStore::upsertScorePoint);

        runner.runBatch(NOW);
        long anomalies = anomalyRepository.count();
        long forecasts = forecastRepository.count();
        long variants = variantRepository.count();

        runner.runBatch(NOW);

        assertThat(anomalyRepository.count()).isEqualTo(anomalies);
        assertThat(forecastRepository.count()).isEqualTo(forecasts);
        assertThat(variantRepository.count()).isEqualTo(variants);
    }

    @Test
    @DisplayName("Single trend run reports its outcome")
    void singleTrend() {
        TestSeries.hourly("youtube_a", 50, 52, 54, 56, 58, 60).getPoints().forEach(trendStore::upsertScorePoint);

        TrendOutcome outcome = runner.processTrend("youtube_a", START.plusHours(5));

        assertThat(outcome.status()).isEqualTo(TrendOutcome.Status.PROCESSED);
        assertThat(outcome.attempts()).isEqualTo(1);
        // Six points are too few for a forecast
        assertThat(outcome.forecastRows()).isZero();
    }

    @Test
    @DisplayName("Empty store gives an empty summary")
    void emptyStore() {
        BatchSummary summary = runner.runBatch(NOW);

        assertThat(summary.trendsProcessed() + summary.trendsSkipped() + summary.trendsFailed()).isZero();
    }

    @Test
    @DisplayName("Scheduler trigger completes and releases its guard")
    void schedulerTrigger() {
        scheduler.runAnalytics();

        assertThat(scheduler.isRunning()).isFalse();
    }
}
