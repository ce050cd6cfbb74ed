package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.ScoreComponents;

import java.time.LocalDateTime;

/**
 * Full metrics of the point nearest to a look-back target.
 */
@JsonTypeName("snapshot")
public record SnapshotPayload(
        LocalDateTime timestamp,
        RawMetrics metrics,
        ScoreComponents components,
        double waveScore,
        double confidence,
        String platformSource
) implements VariantPayload {
}
