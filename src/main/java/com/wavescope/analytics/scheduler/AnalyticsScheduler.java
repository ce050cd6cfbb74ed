package com.wavescope.analytics.scheduler;

import com.wavescope.analytics.service.BatchSummary;
import com.wavescope.analytics.service.TrendAnalyticsRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler for the hourly analytics batch.
 *
 * Flow:
 * 1. Score points ingested (by ScoreIngestionService)
 * 2. TrendAnalyticsRunner derives anomalies, forecasts and variants (this scheduler)
 * 3. Artifacts upserted to DB
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalyticsScheduler {

    private final TrendAnalyticsRunner analyticsRunner;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${analytics.scheduler.cron:0 5 * * * *}")
    public void runAnalytics() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous analytics batch still running, skipping this trigger");
            return;
        }
        try {
            log.info("Running scheduled analytics batch...");
            BatchSummary summary = analyticsRunner.runBatch();
            if (summary.trendsFailed() > 0) {
                log.warn("{} trends failed in this batch", summary.trendsFailed());
            }
        } catch (Exception e) {
            log.error("Error during analytics batch: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
