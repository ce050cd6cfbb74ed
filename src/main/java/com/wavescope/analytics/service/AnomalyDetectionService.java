package com.wavescope.analytics.service;

import com.wavescope.analytics.analysis.Anomaly;
import com.wavescope.analytics.analysis.AnomalyDetector;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.persistence.TrendStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects and stores anomalies for the trends observed in a time window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private final AnomalyDetector anomalyDetector;
    private final TrendStore trendStore;
    private final Clock clock;

    public List<Anomaly> detectAnomalies(Duration window) {
        return detectAnomalies(window, LocalDateTime.now(clock));
    }

    /**
     * Analyze every trend with points in {@code [now - window, now]}.
     * Persistence failures propagate to the caller.
     */
    public List<Anomaly> detectAnomalies(Duration window, LocalDateTime now) {
        Map<String, TrendSeries> byTrend = trendStore.queryWindow(now.minus(window), now);
        if (byTrend.isEmpty()) {
            log.info("No data available for anomaly detection in the last {}", window);
            return List.of();
        }

        log.info("Analyzing {} trends for anomalies", byTrend.size());
        List<Anomaly> detected = new ArrayList<>();
        for (TrendSeries series : byTrend.values()) {
            detected.addAll(detectForSeries(series));
        }

        log.info("Detected {} anomalies", detected.size());
        return detected;
    }

    /**
     * Detect anomalies of one series and store them.
     */
    public List<Anomaly> detectForSeries(TrendSeries series) {
        List<Anomaly> anomalies = anomalyDetector.detect(series);
        if (!anomalies.isEmpty()) {
            trendStore.upsertAnomalies(anomalies);
        }
        return anomalies;
    }
}
