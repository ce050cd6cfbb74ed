package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Map;

/**
 * Per-platform aggregates of a trend observed on several platforms.
 *
 * @param diversityScore normalized Shannon entropy of reach shares, 0..100
 */
@JsonTypeName("platform_comparison")
public record PlatformComparisonPayload(
        Map<String, PlatformStats> byPlatform,
        String bestPerformingPlatform,
        double crossPlatformReach,
        double diversityScore
) implements VariantPayload {
}
