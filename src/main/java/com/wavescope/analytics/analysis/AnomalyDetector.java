package com.wavescope.analytics.analysis;

import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects spikes, drops and unusual patterns in a trend's wave score series.
 *
 * Point anomalies compare each point with the series baseline (z-score) and with
 * its predecessor (relative change). Pattern anomalies look at the whole series.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    // Spike thresholds
    private static final double SPIKE_Z_SCORE = 2.5;
    private static final double SPIKE_RAPID_GROWTH = 0.5;
    private static final double SPIKE_HIGH_SCORE = 80.0;

    // Drop thresholds
    private static final double DROP_Z_SCORE = -2.0;
    private static final double DROP_RAPID_DECLINE = -0.4;
    private static final double DROP_PREVIOUS_MIN = 60.0;
    private static final double DROP_CURRENT_MAX = 40.0;

    // Pattern thresholds
    private static final int PATTERN_MIN_POINTS = 10;
    private static final double VOLATILITY_THRESHOLD = 30.0;
    private static final double OSCILLATION_THRESHOLD = 0.7;

    private final BaselineCalculator baselineCalculator;

    /**
     * Detect all anomalies of a series.
     * Returns an empty list when the series is too short for a baseline.
     */
    public List<Anomaly> detect(TrendSeries series) {
        Optional<BaselineStatistics> baseline = baselineCalculator.compute(series);
        if (baseline.isEmpty()) {
            log.warn("Insufficient data for anomaly detection: {} ({} points)",
                    series.getTrendId(), series.size());
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(detectSpikes(series, baseline.get()));
        anomalies.addAll(detectDrops(series, baseline.get()));
        anomalies.addAll(detectUnusualPatterns(series, baseline.get()));

        List<Anomaly> result = collapseByKey(anomalies);
        if (!result.isEmpty()) {
            log.debug("Detected {} anomalies for {}", result.size(), series.getTrendId());
        }
        return result;
    }

    List<Anomaly> detectSpikes(TrendSeries series, BaselineStatistics baseline) {
        List<Anomaly> spikes = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            ScorePoint previous = series.get(i - 1);
            ScorePoint current = series.get(i);
            double prevScore = previous.getWaveScore();
            double score = current.getWaveScore();

            double zScore = zScore(score, baseline);
            double rate = changeRate(prevScore, score);

            boolean statistical = baseline.stdDev() > 0 && zScore > SPIKE_Z_SCORE;
            boolean rapidGrowth = rate > SPIKE_RAPID_GROWTH;
            if (!statistical && !(rapidGrowth && score > SPIKE_HIGH_SCORE)) {
                continue;
            }

            spikes.add(Anomaly.builder()
                    .trendId(series.getTrendId())
                    .anomalyType(AnomalyType.SPIKE)
                    .severity(spikeSeverity(zScore, rate, score))
                    .anomalyScore(anomalyScore(zScore, rate))
                    .baselineValue(prevScore)
                    .anomalyValue(score)
                    .thresholdExceeded(zScore)
                    .confidence(confidence(zScore, rate))
                    .probableCauses(spikeCauses(current, rate, zScore))
                    .detectionTimestamp(current.getTimestamp())
                    .durationMinutes(durationMinutes(i))
                    .metadata(AnomalyMetadata.pointChange(zScore, rate, statistical, rapidGrowth, baseline))
                    .build());
        }
        return spikes;
    }

    List<Anomaly> detectDrops(TrendSeries series, BaselineStatistics baseline) {
        List<Anomaly> drops = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            ScorePoint previous = series.get(i - 1);
            ScorePoint current = series.get(i);
            double prevScore = previous.getWaveScore();
            double score = current.getWaveScore();

            double zScore = zScore(score, baseline);
            double rate = changeRate(prevScore, score);

            boolean statistical = baseline.stdDev() > 0 && zScore < DROP_Z_SCORE;
            boolean rapidDecline = rate < DROP_RAPID_DECLINE;
            boolean significant = prevScore > DROP_PREVIOUS_MIN && score < DROP_CURRENT_MAX;
            if (!statistical && !(rapidDecline && significant)) {
                continue;
            }

            drops.add(Anomaly.builder()
                    .trendId(series.getTrendId())
                    .anomalyType(AnomalyType.DROP)
                    .severity(dropSeverity(zScore, rate, score))
                    .anomalyScore(anomalyScore(zScore, rate))
                    .baselineValue(prevScore)
                    .anomalyValue(score)
                    .thresholdExceeded(Math.abs(zScore))
                    .confidence(confidence(zScore, rate))
                    .probableCauses(dropCauses(rate, zScore))
                    .detectionTimestamp(current.getTimestamp())
                    .durationMinutes(durationMinutes(i))
                    .metadata(AnomalyMetadata.pointChange(zScore, rate, statistical, rapidDecline, baseline))
                    .build());
        }
        return drops;
    }

    List<Anomaly> detectUnusualPatterns(TrendSeries series, BaselineStatistics baseline) {
        List<Anomaly> patterns = new ArrayList<>();
        if (series.size() < PATTERN_MIN_POINTS) {
            return patterns;
        }

        int lastIndex = series.size() - 1;
        LocalDateTime lastTimestamp = series.last().getTimestamp();
        double volatility = baseline.stdDev();

        if (volatility > VOLATILITY_THRESHOLD) {
            patterns.add(Anomaly.builder()
                    .trendId(series.getTrendId())
                    .anomalyType(AnomalyType.UNUSUAL_PATTERN)
                    .severity(AnomalySeverity.MEDIUM)
                    .anomalyScore(Math.min(100.0, volatility * 2))
                    .baselineValue(baseline.mean())
                    .anomalyValue(volatility)
                    .thresholdExceeded(volatility - VOLATILITY_THRESHOLD)
                    .confidence(0.75)
                    .probableCauses(List.of("high_volatility", "irregular_pattern", "external_factors"))
                    .detectionTimestamp(lastTimestamp)
                    .durationMinutes(durationMinutes(lastIndex))
                    .metadata(AnomalyMetadata.volatilityPattern(volatility, series.size()))
                    .build());
        }

        double oscillation = oscillationRatio(series.waveScores());
        if (oscillation > OSCILLATION_THRESHOLD) {
            patterns.add(Anomaly.builder()
                    .trendId(series.getTrendId())
                    .anomalyType(AnomalyType.UNUSUAL_PATTERN)
                    .severity(AnomalySeverity.LOW)
                    .anomalyScore(SeriesMath.clampScore(oscillation * 100))
                    .baselineValue(baseline.mean())
                    .anomalyValue(oscillation)
                    .thresholdExceeded(oscillation - OSCILLATION_THRESHOLD)
                    .confidence(0.65)
                    .probableCauses(List.of("oscillating_behavior", "competing_trends", "user_fatigue"))
                    .detectionTimestamp(lastTimestamp)
                    .durationMinutes(durationMinutes(lastIndex))
                    .metadata(AnomalyMetadata.oscillationPattern(oscillation, series.size()))
                    .build());
        }
        return patterns;
    }

    /**
     * Fraction of direction reversals between consecutive non-zero deltas.
     * 0 for a monotonic series, close to 1 for one alternating every step.
     */
    public static double oscillationRatio(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        int reversals = 0;
        double lastDirection = 0;
        for (int i = 1; i < values.length; i++) {
            double direction = Math.signum(values[i] - values[i - 1]);
            if (direction != 0 && lastDirection != 0 && direction != lastDirection) {
                reversals++;
            }
            if (direction != 0) {
                lastDirection = direction;
            }
        }
        return (double) reversals / (values.length - 1);
    }

    static AnomalySeverity spikeSeverity(double zScore, double rate, double score) {
        if (zScore > 3.5 || rate > 1.0 || score > 90) return AnomalySeverity.CRITICAL;
        if (zScore > 3.0 || rate > 0.7 || score > 85) return AnomalySeverity.HIGH;
        if (zScore > 2.5 || rate > 0.5 || score > 75) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    static AnomalySeverity dropSeverity(double zScore, double rate, double score) {
        double z = Math.abs(zScore);
        double r = Math.abs(rate);
        if (z > 3.0 || r > 0.8 || score < 10) return AnomalySeverity.HIGH;
        if (z > 2.5 || r > 0.6 || score < 20) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    private static double zScore(double score, BaselineStatistics baseline) {
        if (baseline.stdDev() == 0) {
            return 0.0;
        }
        return (score - baseline.mean()) / baseline.stdDev();
    }

    private static double changeRate(double previous, double current) {
        if (previous <= 0) {
            return 0.0;
        }
        return (current - previous) / previous;
    }

    static double anomalyScore(double zScore, double rate) {
        return SeriesMath.clampScore(Math.abs(zScore) * 10 + Math.abs(rate) * 50);
    }

    static double confidence(double zScore, double rate) {
        double zConfidence = Math.min(1.0, Math.abs(zScore) / 4.0);
        double changeConfidence = Math.min(1.0, Math.abs(rate));
        return (zConfidence + changeConfidence) / 2;
    }

    private static int durationMinutes(int index) {
        return Math.min(60, index * 10);
    }

    private static List<String> spikeCauses(ScorePoint point, double rate, double zScore) {
        List<String> causes = new ArrayList<>();
        if (rate > 0.8) causes.add("viral_acceleration");
        if (zScore > 3.0) causes.add("statistical_outlier");
        if ("tiktok".equalsIgnoreCase(point.getPlatformSource())) causes.add("tiktok_algorithm_boost");
        if ("youtube".equalsIgnoreCase(point.getPlatformSource())) causes.add("youtube_trending");
        causes.add("possible_external_event");
        causes.add("influencer_mention");
        causes.add("news_coverage");
        return List.copyOf(causes);
    }

    private static List<String> dropCauses(double rate, double zScore) {
        List<String> causes = new ArrayList<>();
        if (Math.abs(rate) > 0.6) causes.add("rapid_decline");
        if (Math.abs(zScore) > 2.5) causes.add("statistical_drop");
        causes.add("user_fatigue");
        causes.add("algorithm_change");
        causes.add("competing_content");
        causes.add("trend_saturation");
        return List.copyOf(causes);
    }

    /**
     * Two pattern anomalies can share a storage key; the stronger one is kept.
     */
    private static List<Anomaly> collapseByKey(List<Anomaly> anomalies) {
        Map<String, Anomaly> byKey = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            String key = anomaly.getDetectionTimestamp() + "|" + anomaly.getAnomalyType();
            byKey.merge(key, anomaly, (a, b) -> b.getAnomalyScore() > a.getAnomalyScore() ? b : a);
        }
        return new ArrayList<>(byKey.values());
    }
}
