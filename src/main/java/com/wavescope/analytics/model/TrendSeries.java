package com.wavescope.analytics.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ordered ScorePoints of a single trend.
 *
 * Timestamps are strictly increasing: when two points share a timestamp the later
 * one in the input replaces the earlier one, matching upsert semantics of the store.
 */
public final class TrendSeries {

    private final String trendId;
    private final List<ScorePoint> points;

    private TrendSeries(String trendId, List<ScorePoint> points) {
        this.trendId = trendId;
        this.points = Collections.unmodifiableList(points);
    }

    public static TrendSeries of(String trendId, Collection<ScorePoint> points) {
        Objects.requireNonNull(trendId, "trendId");
        TreeMap<LocalDateTime, ScorePoint> byTimestamp = new TreeMap<>();
        if (points != null) {
            for (ScorePoint point : points) {
                if (point != null && point.getTimestamp() != null) {
                    byTimestamp.put(point.getTimestamp(), point);
                }
            }
        }
        return new TrendSeries(trendId, new ArrayList<>(byTimestamp.values()));
    }

    public static TrendSeries empty(String trendId) {
        return new TrendSeries(trendId, new ArrayList<>());
    }

    public String getTrendId() {
        return trendId;
    }

    public List<ScorePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public ScorePoint get(int index) {
        return points.get(index);
    }

    public ScorePoint first() {
        return points.isEmpty() ? null : points.get(0);
    }

    public ScorePoint last() {
        return points.isEmpty() ? null : points.get(points.size() - 1);
    }

    public double[] waveScores() {
        double[] scores = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            scores[i] = points.get(i).getWaveScore();
        }
        return scores;
    }

    /**
     * Hours elapsed between the first point and the given timestamp.
     */
    public double hoursSinceStart(LocalDateTime timestamp) {
        if (points.isEmpty()) return 0.0;
        return Duration.between(first().getTimestamp(), timestamp).toMillis() / 3_600_000.0;
    }

    public double timeSpanHours() {
        if (points.size() < 2) return 0.0;
        return hoursSinceStart(last().getTimestamp());
    }

    /**
     * Distinct platforms in order of first appearance.
     */
    public Set<String> platforms() {
        Set<String> platforms = new LinkedHashSet<>();
        for (ScorePoint point : points) {
            if (point.getPlatformSource() != null) {
                platforms.add(point.getPlatformSource());
            }
        }
        return platforms;
    }

    public String category() {
        return points.isEmpty() ? null : first().getCategory();
    }

    /**
     * Points with {@code from <= timestamp <= to}; either bound may be null.
     */
    public TrendSeries between(LocalDateTime from, LocalDateTime to) {
        List<ScorePoint> selected = new ArrayList<>();
        for (ScorePoint point : points) {
            LocalDateTime ts = point.getTimestamp();
            if ((from == null || !ts.isBefore(from)) && (to == null || !ts.isAfter(to))) {
                selected.add(point);
            }
        }
        return new TrendSeries(trendId, selected);
    }

    @Override
    public String toString() {
        return "TrendSeries{" + trendId + ", points=" + points.size() + "}";
    }
}
