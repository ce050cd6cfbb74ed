package com.wavescope.analytics.variant;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A derived view of a trend's history, keyed by (trendId, variantType, variantName).
 */
@Value
@Builder
public class Variant {

    String trendId;
    VariantType variantType;
    String variantName;
    LocalDateTime timeRangeStart;
    LocalDateTime timeRangeEnd;
    VariantPayload payload;
    VariantMetadata metadata;
}
