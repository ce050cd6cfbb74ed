package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Summary of the points inside one timeframe. {@code trendAnalysis} is null below two points.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeName("aggregated")
public record AggregatedPayload(
        MetricSummary waveScore,
        MetricSummary engagement,
        MetricSummary reach,
        int dataPoints,
        double timeSpanHours,
        TrendAnalysis trendAnalysis
) implements VariantPayload {
}
