package com.wavescope.analytics.score;

import java.util.List;

/**
 * Short-term outlook of a trend derived from its growth metrics.
 *
 * @param confidence     0..100
 * @param hoursToPeak    estimated hours until the trend peaks
 */
public record TrendOutlook(
        Direction direction,
        int confidence,
        List<String> reasons,
        int hoursToPeak,
        List<String> riskFactors
) {

    public enum Direction {
        RISING,
        DECLINING,
        STABLE
    }
}
