package com.wavescope.analytics.persistence;

import com.wavescope.analytics.analysis.Anomaly;
import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.variant.Variant;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage of score points and derived artifacts.
 *
 * Every upsert is keyed by the artifact's natural key and replaces the stored row wholesale,
 * so repeating a write with the same input leaves the store unchanged.
 * Failures surface as Spring {@code DataAccessException}s.
 */
public interface TrendStore {

    /**
     * Points of one trend with {@code from <= timestamp <= to}.
     */
    TrendSeries querySeries(String trendId, LocalDateTime from, LocalDateTime to);

    /**
     * Points of every trend observed in the range, keyed by trend id in ascending order.
     */
    Map<String, TrendSeries> queryWindow(LocalDateTime from, LocalDateTime to);

    List<String> findTrendIds(LocalDateTime from, LocalDateTime to);

    /**
     * Series of up to {@code limit} other trends of the same category, excluding
     * the given trend and the same content on other platforms.
     */
    List<TrendSeries> queryPeers(String category, String excludeTrendId, String excludeContentId,
                                 LocalDateTime from, LocalDateTime to, int limit);

    /**
     * Points of every trend of one category with {@code from <= timestamp <= to}, unordered.
     * A null category selects uncategorized points.
     */
    List<ScorePoint> queryCategoryPoints(String category, LocalDateTime from, LocalDateTime to);

    Optional<ScorePoint> findLatestPoint(String trendId, LocalDateTime before);

    /**
     * Up to three most recent viral scores before the given time, oldest first.
     */
    List<Double> findRecentViralScores(String trendId, LocalDateTime before);

    ScorePoint upsertScorePoint(ScorePoint point);

    int upsertAnomalies(List<Anomaly> anomalies);

    int upsertForecast(EnsembleForecast forecast);

    int upsertVariants(List<Variant> variants);

    List<Anomaly> findAnomalies(String trendId);

    List<Anomaly> findAnomaliesDetectedBetween(LocalDateTime from, LocalDateTime to);

    Optional<EnsembleForecast> findLatestForecast(String trendId);

    List<Variant> findVariants(String trendId);
}
