package com.wavescope.analytics.model;

/**
 * Raw engagement counters of one observation.
 * Missing or negative counters are normalized to 0.
 */
public record RawMetrics(long views, long likes, long comments, long shares) {

    public static final RawMetrics EMPTY = new RawMetrics(0, 0, 0, 0);

    public RawMetrics {
        views = Math.max(0, views);
        likes = Math.max(0, likes);
        comments = Math.max(0, comments);
        shares = Math.max(0, shares);
    }

    public static RawMetrics of(Long views, Long likes, Long comments, Long shares) {
        return new RawMetrics(orZero(views), orZero(likes), orZero(comments), orZero(shares));
    }

    public boolean hasEngagement() {
        return likes > 0 || comments > 0;
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
