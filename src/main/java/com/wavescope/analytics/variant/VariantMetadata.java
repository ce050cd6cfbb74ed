package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Descriptive fields of a variant. Only the fields relevant to the variant family are set.
 *
 * @param label timeframe, look-back interval or horizon, e.g. {@code 24h}
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariantMetadata(
        String label,
        Double dataQuality,
        Integer dataPoints,
        Double confidenceScore,
        String algorithm,
        List<String> warningFlags,
        List<String> comparedTrends,
        List<String> platformsAnalyzed
) {
}
