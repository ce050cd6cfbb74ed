package com.wavescope.analytics.variant;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed body of a variant. The {@code kind} property tags the concrete record in JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SnapshotPayload.class, name = "snapshot"),
        @JsonSubTypes.Type(value = AggregatedPayload.class, name = "aggregated"),
        @JsonSubTypes.Type(value = ProjectionPayload.class, name = "projection"),
        @JsonSubTypes.Type(value = PerformanceComparisonPayload.class, name = "performance_comparison"),
        @JsonSubTypes.Type(value = PlatformComparisonPayload.class, name = "platform_comparison")
})
public interface VariantPayload {
}
