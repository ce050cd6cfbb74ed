package com.wavescope.analytics.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wavescope.analytics.analysis.Anomaly;
import com.wavescope.analytics.analysis.BaselineCalculator;
import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.persistence.TrendStore;
import com.wavescope.analytics.variant.Variant;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs anomaly detection, forecasting and variant generation for every active trend.
 *
 * Flow:
 * 1. Trends with points in the anomaly window are listed
 * 2. Each trend is processed on the worker pool: anomalies, forecast, variants
 * 3. A failing trend is retried as a whole; upserts make retries safe
 * 4. Tasks still running at the deadline are cancelled and counted as failed
 */
@Service
@Slf4j
public class TrendAnalyticsRunner {

    private final TrendStore trendStore;
    private final BaselineCalculator baselineCalculator;
    private final AnomalyDetectionService anomalyService;
    private final ForecastService forecastService;
    private final VariantService variantService;
    private final Clock clock;
    private final ExecutorService workers;

    @Value("${analytics.anomaly.window-hours:24}")
    private int anomalyWindowHours;

    @Value("${analytics.forecast.horizon-hours:24}")
    private int forecastHorizonHours;

    @Value("${analytics.forecast.history-days:7}")
    private int forecastHistoryDays;

    @Value("${analytics.variant.history-days:30}")
    private int variantHistoryDays;

    @Value("${analytics.batch.max-attempts:3}")
    private int maxAttempts;

    @Value("${analytics.batch.deadline-seconds:600}")
    private long deadlineSeconds;

    public TrendAnalyticsRunner(TrendStore trendStore,
                                BaselineCalculator baselineCalculator,
                                AnomalyDetectionService anomalyService,
                                ForecastService forecastService,
                                VariantService variantService,
                                Clock clock,
                                @Value("${analytics.batch.worker-threads:4}") int workerThreads) {
        this.trendStore = trendStore;
        this.baselineCalculator = baselineCalculator;
        this.anomalyService = anomalyService;
        this.forecastService = forecastService;
        this.variantService = variantService;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads),
                new ThreadFactoryBuilder().setNameFormat("trend-analytics-%d").setDaemon(true).build());
    }

    public BatchSummary runBatch() {
        return runBatch(LocalDateTime.now(clock));
    }

    public BatchSummary runBatch(LocalDateTime now) {
        long started = System.currentTimeMillis();
        List<String> trendIds = trendStore.findTrendIds(now.minusHours(anomalyWindowHours), now);
        if (trendIds.isEmpty()) {
            log.info("No active trends in the last {}h", anomalyWindowHours);
            return BatchSummary.empty(System.currentTimeMillis() - started);
        }

        log.info("Starting analytics batch for {} trends", trendIds.size());

        List<Callable<TrendOutcome>> tasks = new ArrayList<>();
        for (String trendId : trendIds) {
            tasks.add(() -> processTrend(trendId, now));
        }

        List<Future<TrendOutcome>> futures;
        try {
            futures = workers.invokeAll(tasks, deadlineSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Analytics batch interrupted");
            return BatchSummary.empty(System.currentTimeMillis() - started);
        }

        int processed = 0, skipped = 0, failed = 0, anomalies = 0, forecastRows = 0, variants = 0;
        for (int i = 0; i < futures.size(); i++) {
            TrendOutcome outcome = outcomeOf(trendIds.get(i), futures.get(i));
            switch (outcome.status()) {
                case PROCESSED -> processed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
            anomalies += outcome.anomalies();
            forecastRows += outcome.forecastRows();
            variants += outcome.variants();
        }

        BatchSummary summary = new BatchSummary(processed, skipped, failed, anomalies, forecastRows, variants,
                System.currentTimeMillis() - started);
        log.info("Analytics batch complete: {} processed, {} skipped, {} failed, {} anomalies, {} forecast rows, {} variants in {}ms",
                summary.trendsProcessed(), summary.trendsSkipped(), summary.trendsFailed(),
                summary.anomalies(), summary.forecastRows(), summary.variants(), summary.elapsedMs());
        return summary;
    }

    /**
     * Derive all artifacts of one trend, retrying the whole derivation on failure.
     */
    public TrendOutcome processTrend(String trendId, LocalDateTime now) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return deriveArtifacts(trendId, now, attempt);
            } catch (RuntimeException e) {
                if (attempt < maxAttempts) {
                    log.warn("Trend {} failed (attempt {}/{}), retrying: {}", trendId, attempt, maxAttempts, e.getMessage());
                } else {
                    log.error("Trend {} failed after {} attempts: {}", trendId, maxAttempts, e.getMessage(), e);
                }
            }
        }
        return TrendOutcome.failed(trendId, maxAttempts);
    }

    private TrendOutcome deriveArtifacts(String trendId, LocalDateTime now, int attempt) {
        LocalDateTime historyStart = now.minusDays(Math.max(variantHistoryDays, forecastHistoryDays));
        TrendSeries history = trendStore.querySeries(trendId, historyStart, now);
        TrendSeries recent = history.between(now.minusHours(anomalyWindowHours), now);

        if (baselineCalculator.compute(recent).isEmpty()) {
            log.warn("Insufficient data for {} ({} points in {}h), skipping", trendId, recent.size(), anomalyWindowHours);
            return TrendOutcome.skipped(trendId);
        }

        List<Anomaly> anomalies = anomalyService.detectForSeries(recent);

        Optional<EnsembleForecast> forecast = forecastService.forecastSeries(
                history.between(now.minusDays(forecastHistoryDays), now), forecastHorizonHours);

        List<Variant> variants = variantService.generateVariants(
                trendId, history.between(now.minusDays(variantHistoryDays), now), variantService.defaultOptions(), now);

        return new TrendOutcome(trendId, TrendOutcome.Status.PROCESSED, attempt,
                anomalies.size(),
                forecast.map(f -> f.getPredictions().size()).orElse(0),
                variants.size());
    }

    private TrendOutcome outcomeOf(String trendId, Future<TrendOutcome> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.error("Trend {} did not finish before the {}s deadline", trendId, deadlineSeconds);
        } catch (ExecutionException e) {
            log.error("Trend {} failed: {}", trendId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while collecting result of {}", trendId);
        }
        return TrendOutcome.failed(trendId, 0);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
