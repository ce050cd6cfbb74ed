package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("projection")
public record ProjectionPayload(
        double projectedWaveScore,
        double confidenceLower,
        double confidenceUpper,
        double confidenceLevel,
        int projectionHours,
        List<String> warningFlags,
        double slope,
        double intercept,
        double rSquared,
        int basedOnPoints
) implements VariantPayload {
}
