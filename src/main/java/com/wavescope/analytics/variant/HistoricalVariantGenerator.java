package com.wavescope.analytics.variant;

import com.wavescope.analytics.forecast.LinearRegressionModel;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.LinearFit;
import com.wavescope.analytics.stats.SeriesMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds snapshot, aggregated, projected and comparative views of a trend's history.
 *
 * Generation is a pure function of the series, the peer series and {@code now}:
 * identical inputs always produce identical variants.
 */
@Component
@Slf4j
public class HistoricalVariantGenerator {

    static final Map<String, Duration> SNAPSHOT_INTERVALS = intervals("1h", "6h", "24h", "7d");
    static final Map<String, Duration> AGGREGATION_TIMEFRAMES = intervals("1h", "6h", "24h", "7d", "30d");
    static final Map<String, Duration> PROJECTION_HORIZONS = intervals("6h", "24h", "7d");

    private static final double DIRECTION_THRESHOLD = 0.1;
    private static final double STEEP_SLOPE = 10.0;
    private static final double MIN_PROJECTION_CONFIDENCE = 0.3;

    public List<Variant> generate(TrendSeries series, List<TrendSeries> peers, VariantOptions options,
                                  LocalDateTime now) {
        List<Variant> variants = new ArrayList<>();
        if (series == null || series.isEmpty()) {
            log.debug("No points to build variants from");
            return variants;
        }
        VariantOptions effective = options != null ? options : VariantOptions.defaults();

        if (effective.snapshots()) {
            variants.addAll(snapshotVariants(series, now));
        }
        if (effective.aggregates()) {
            variants.addAll(aggregatedVariants(series, now));
        }
        if (effective.projections()) {
            variants.addAll(projectedVariants(series, now));
        }
        if (effective.comparisons()) {
            variants.addAll(comparativeVariants(series, peers != null ? peers : List.of()));
        }

        log.debug("Generated {} variants for {}", variants.size(), series.getTrendId());
        return variants;
    }

    // --- Snapshots ---

    List<Variant> snapshotVariants(TrendSeries series, LocalDateTime now) {
        List<Variant> snapshots = new ArrayList<>();
        for (Map.Entry<String, Duration> interval : SNAPSHOT_INTERVALS.entrySet()) {
            ScorePoint closest = closestPoint(series, now.minus(interval.getValue()));

            snapshots.add(Variant.builder()
                    .trendId(series.getTrendId())
                    .variantType(VariantType.SNAPSHOT)
                    .variantName("snapshot_" + interval.getKey() + "_ago")
                    .timeRangeStart(closest.getTimestamp())
                    .timeRangeEnd(closest.getTimestamp())
                    .payload(new SnapshotPayload(
                            closest.getTimestamp(),
                            closest.getRawMetrics(),
                            closest.getComponents(),
                            closest.getWaveScore(),
                            closest.getConfidence(),
                            closest.getPlatformSource()))
                    .metadata(VariantMetadata.builder()
                            .label(interval.getKey())
                            .dataQuality(dataQuality(closest, now))
                            .build())
                    .build());
        }
        return snapshots;
    }

    /**
     * Point nearest to the target; on a tie the earlier point wins.
     */
    static ScorePoint closestPoint(TrendSeries series, LocalDateTime target) {
        ScorePoint closest = null;
        long minDiff = Long.MAX_VALUE;
        for (ScorePoint point : series.getPoints()) {
            long diff = Math.abs(Duration.between(point.getTimestamp(), target).toMillis());
            if (diff < minDiff) {
                minDiff = diff;
                closest = point;
            }
        }
        return closest;
    }

    static double dataQuality(ScorePoint point, LocalDateTime now) {
        double quality = 1.0;
        if (point.getRawMetrics() == null || point.getRawMetrics().views() == 0) quality *= 0.7;
        if (point.getComponents() == null) quality *= 0.8;
        if (point.getWaveScore() == 0) quality *= 0.9;
        if (hoursBetween(point.getTimestamp(), now) > 24) quality *= 0.9;
        return SeriesMath.round2(quality);
    }

    // --- Aggregates ---

    List<Variant> aggregatedVariants(TrendSeries series, LocalDateTime now) {
        List<Variant> aggregated = new ArrayList<>();
        for (Map.Entry<String, Duration> timeframe : AGGREGATION_TIMEFRAMES.entrySet()) {
            TrendSeries window = series.between(now.minus(timeframe.getValue()), null);
            if (window.isEmpty()) {
                continue;
            }

            aggregated.add(Variant.builder()
                    .trendId(series.getTrendId())
                    .variantType(VariantType.AGGREGATED)
                    .variantName("aggregated_" + timeframe.getKey())
                    .timeRangeStart(window.first().getTimestamp())
                    .timeRangeEnd(window.last().getTimestamp())
                    .payload(aggregate(window))
                    .metadata(VariantMetadata.builder()
                            .label(timeframe.getKey())
                            .dataPoints(window.size())
                            .confidenceScore(aggregationConfidence(window, now))
                            .build())
                    .build());
        }
        return aggregated;
    }

    static AggregatedPayload aggregate(TrendSeries window) {
        double[] waveScores = window.waveScores();
        double[] engagement = new double[window.size()];
        double[] reach = new double[window.size()];
        for (int i = 0; i < window.size(); i++) {
            engagement[i] = window.get(i).getEngagementScore();
            reach[i] = window.get(i).getReach();
        }

        return new AggregatedPayload(
                summarize(waveScores),
                summarize(engagement),
                summarize(reach),
                window.size(),
                window.timeSpanHours(),
                analyzeTrend(window));
    }

    static MetricSummary summarize(double[] values) {
        return new MetricSummary(
                SeriesMath.mean(values),
                SeriesMath.max(values),
                SeriesMath.min(values),
                SeriesMath.stdDev(values),
                SeriesMath.sum(values),
                SeriesMath.indexSlope(values));
    }

    /**
     * @return null below two points
     */
    static TrendAnalysis analyzeTrend(TrendSeries window) {
        if (window.size() < 2) {
            return null;
        }
        double[] scores = window.waveScores();
        LinearFit fit = SeriesMath.fitByIndex(scores);

        String direction = fit.slope() > DIRECTION_THRESHOLD ? "rising"
                : fit.slope() < -DIRECTION_THRESHOLD ? "falling" : "stable";

        double span = window.timeSpanHours();
        double totalChange = scores[scores.length - 1] - scores[0];
        double velocity = span > 0 ? totalChange / span : 0.0;
        double volatility = SeriesMath.stdDev(scores);

        return new TrendAnalysis(
                direction,
                velocity,
                acceleration(scores),
                volatility,
                momentum(scores, fit.slope(), volatility),
                fit.slope(),
                fit.rSquared());
    }

    static double acceleration(double[] values) {
        if (values.length < 3) {
            return 0.0;
        }
        double[] second = new double[values.length - 2];
        for (int i = 2; i < values.length; i++) {
            second[i - 2] = (values[i] - values[i - 1]) - (values[i - 1] - values[i - 2]);
        }
        return SeriesMath.mean(second);
    }

    static double momentum(double[] values, double trend, double volatility) {
        double recentChange = values[values.length - 1] - values[Math.max(0, values.length - 5)];
        return Math.abs(trend) * 0.4 + Math.abs(recentChange) * 0.4 + (100 - volatility) * 0.2;
    }

    static double aggregationConfidence(TrendSeries window, LocalDateTime now) {
        if (window.isEmpty()) {
            return 0.0;
        }
        double confidence = Math.min(1.0, window.size() / 10.0);

        double qualitySum = 0;
        for (ScorePoint point : window.getPoints()) {
            qualitySum += dataQuality(point, now);
        }
        confidence *= qualitySum / window.size();

        double span = window.timeSpanHours();
        if (span > 0 && span < 168) {
            confidence *= Math.min(1.0, span / 24);
        }
        return SeriesMath.round2(confidence);
    }

    // --- Projections ---

    List<Variant> projectedVariants(TrendSeries series, LocalDateTime now) {
        List<Variant> projected = new ArrayList<>();
        if (series.size() < 2) {
            return projected;
        }

        LinearFit fit = LinearRegressionModel.fit(series);
        double confidence = Math.max(MIN_PROJECTION_CONFIDENCE, fit.rSquared());
        if (Math.abs(fit.slope()) > STEEP_SLOPE) {
            confidence *= 0.8;
        }
        double lastValue = series.last().getWaveScore();
        List<String> seriesWarnings = projectionWarnings(series, fit);
        double quality = projectionDataQuality(series, now);

        for (Map.Entry<String, Duration> horizon : PROJECTION_HORIZONS.entrySet()) {
            int hours = (int) horizon.getValue().toHours();
            double raw = lastValue + fit.slope() * hours;
            double projectedScore = SeriesMath.clampScore(raw);
            double margin = Math.max(0.0, (100 - projectedScore) * (1 - confidence) * 0.5);

            List<String> flags = new ArrayList<>();
            if (confidence < 0.5) flags.add("low_confidence");
            if (projectedScore > 90) flags.add("extreme_high_score");
            if (projectedScore < 10) flags.add("extreme_low_score");

            projected.add(Variant.builder()
                    .trendId(series.getTrendId())
                    .variantType(VariantType.PROJECTED)
                    .variantName("projection_" + horizon.getKey() + "_ahead")
                    .timeRangeStart(series.last().getTimestamp())
                    .timeRangeEnd(now.plus(horizon.getValue()))
                    .payload(new ProjectionPayload(
                            projectedScore,
                            SeriesMath.clampScore(projectedScore - margin),
                            SeriesMath.clampScore(projectedScore + margin),
                            SeriesMath.round2(confidence),
                            hours,
                            List.copyOf(flags),
                            fit.slope(),
                            fit.intercept(),
                            fit.rSquared(),
                            series.size()))
                    .metadata(VariantMetadata.builder()
                            .label(horizon.getKey())
                            .algorithm("linear_regression")
                            .dataQuality(quality)
                            .warningFlags(seriesWarnings)
                            .build())
                    .build());
        }
        return projected;
    }

    static List<String> projectionWarnings(TrendSeries series, LinearFit fit) {
        List<String> warnings = new ArrayList<>();
        if (series.size() < 5) warnings.add("insufficient_data");
        if (fit.rSquared() < 0.5) warnings.add("low_correlation");
        if (SeriesMath.stdDev(series.waveScores()) > 30) warnings.add("high_volatility");
        if (series.timeSpanHours() < 6) warnings.add("short_time_span");
        return List.copyOf(warnings);
    }

    static double projectionDataQuality(TrendSeries series, LocalDateTime now) {
        double volatilityPenalty = Math.min(0.5, SeriesMath.stdDev(series.waveScores()) / 100);
        return SeriesMath.round2(Math.max(0.1, aggregationConfidence(series, now) - volatilityPenalty));
    }

    // --- Comparisons ---

    List<Variant> comparativeVariants(TrendSeries series, List<TrendSeries> peers) {
        List<Variant> comparative = new ArrayList<>();

        List<TrendSeries> usablePeers = peers.stream()
                .filter(p -> !p.isEmpty() && !p.getTrendId().equals(series.getTrendId()))
                .toList();
        if (!usablePeers.isEmpty()) {
            PerformanceComparisonPayload performance = performanceComparison(series, usablePeers);
            comparative.add(Variant.builder()
                    .trendId(series.getTrendId())
                    .variantType(VariantType.COMPARATIVE)
                    .variantName("performance_comparison")
                    .timeRangeStart(series.first().getTimestamp())
                    .timeRangeEnd(series.last().getTimestamp())
                    .payload(performance)
                    .metadata(VariantMetadata.builder()
                            .comparedTrends(usablePeers.stream().map(TrendSeries::getTrendId).toList())
                            .dataPoints(usablePeers.size())
                            .build())
                    .build());
        }

        PlatformComparisonPayload platforms = platformComparison(series);
        if (platforms != null) {
            comparative.add(Variant.builder()
                    .trendId(series.getTrendId())
                    .variantType(VariantType.COMPARATIVE)
                    .variantName("platform_comparison")
                    .timeRangeStart(series.first().getTimestamp())
                    .timeRangeEnd(series.last().getTimestamp())
                    .payload(platforms)
                    .metadata(VariantMetadata.builder()
                            .platformsAnalyzed(List.copyOf(platforms.byPlatform().keySet()))
                            .build())
                    .build());
        }
        return comparative;
    }

    static PerformanceComparisonPayload performanceComparison(TrendSeries series, List<TrendSeries> peers) {
        PeerMetrics current = peerMetrics(series);
        List<PeerMetrics> peerMetrics = peers.stream().map(HistoricalVariantGenerator::peerMetrics).toList();

        double[] peerMax = peerMetrics.stream().mapToDouble(PeerMetrics::maxWaveScore).toArray();
        double[] peerReach = peerMetrics.stream().mapToDouble(PeerMetrics::totalReach).toArray();

        return new PerformanceComparisonPayload(
                current,
                peerMetrics,
                SeriesMath.round2(percentileRank(current.maxWaveScore(), peerMax)),
                SeriesMath.round2(percentileRank(current.totalReach(), peerReach)),
                ranking(current.maxWaveScore(), peerMax),
                ranking(current.totalReach(), peerReach));
    }

    static PeerMetrics peerMetrics(TrendSeries series) {
        double[] scores = series.waveScores();
        double reach = 0;
        for (ScorePoint point : series.getPoints()) {
            reach += point.getReach();
        }
        return new PeerMetrics(series.getTrendId(), SeriesMath.max(scores), SeriesMath.mean(scores), reach);
    }

    /**
     * Share of the dataset at or below the value, in percent. 100 for an empty dataset.
     */
    public static double percentileRank(double value, double[] dataset) {
        if (dataset.length == 0) {
            return 100.0;
        }
        int atOrBelow = 0;
        for (double v : dataset) {
            if (v <= value) atOrBelow++;
        }
        return (double) atOrBelow / dataset.length * 100.0;
    }

    /**
     * 1 + number of dataset values strictly greater than the value.
     */
    public static int ranking(double value, double[] dataset) {
        int greater = 0;
        for (double v : dataset) {
            if (v > value) greater++;
        }
        return greater + 1;
    }

    /**
     * @return null when the series covers fewer than two platforms
     */
    static PlatformComparisonPayload platformComparison(TrendSeries series) {
        if (series.platforms().size() < 2) {
            return null;
        }

        Map<String, PlatformStats> byPlatform = new LinkedHashMap<>();
        for (String platform : series.platforms()) {
            List<ScorePoint> points = series.getPoints().stream()
                    .filter(p -> platform.equals(p.getPlatformSource()))
                    .toList();
            double[] scores = points.stream().mapToDouble(ScorePoint::getWaveScore).toArray();
            double[] engagement = points.stream().mapToDouble(ScorePoint::getEngagementScore).toArray();
            double reach = points.stream().mapToDouble(ScorePoint::getReach).sum();
            byPlatform.put(platform, new PlatformStats(
                    points.size(),
                    SeriesMath.mean(scores),
                    SeriesMath.max(scores),
                    reach,
                    SeriesMath.mean(engagement)));
        }

        String best = null;
        double bestAverage = Double.NEGATIVE_INFINITY;
        double totalReach = 0;
        for (Map.Entry<String, PlatformStats> entry : byPlatform.entrySet()) {
            totalReach += entry.getValue().totalReach();
            if (entry.getValue().avgWaveScore() > bestAverage) {
                bestAverage = entry.getValue().avgWaveScore();
                best = entry.getKey();
            }
        }

        return new PlatformComparisonPayload(byPlatform, best, totalReach, diversityScore(byPlatform, totalReach));
    }

    /**
     * Shannon entropy of reach shares normalized by log2(platforms), in percent.
     */
    static double diversityScore(Map<String, PlatformStats> byPlatform, double totalReach) {
        if (totalReach <= 0 || byPlatform.size() < 2) {
            return 0.0;
        }
        double entropy = 0;
        for (PlatformStats stats : byPlatform.values()) {
            double share = stats.totalReach() / totalReach;
            if (share > 0) {
                entropy -= share * (Math.log(share) / Math.log(2));
            }
        }
        double maxEntropy = Math.log(byPlatform.size()) / Math.log(2);
        return SeriesMath.clampScore(entropy / maxEntropy * 100);
    }

    private static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMillis() / 3_600_000.0;
    }

    private static Map<String, Duration> intervals(String... labels) {
        Map<String, Duration> intervals = new LinkedHashMap<>();
        for (String label : labels) {
            long value = Long.parseLong(label.substring(0, label.length() - 1));
            intervals.put(label, label.endsWith("d") ? Duration.ofDays(value) : Duration.ofHours(value));
        }
        return intervals;
    }
}
