package com.wavescope.analytics.variant;

/**
 * Selects the variant families to generate and bounds the peer lookup.
 */
public record VariantOptions(
        boolean snapshots,
        boolean aggregates,
        boolean projections,
        boolean comparisons,
        int peerLimit,
        int peerLookbackDays
) {

    public static VariantOptions all(int peerLimit, int peerLookbackDays) {
        return new VariantOptions(true, true, true, true, peerLimit, peerLookbackDays);
    }

    public static VariantOptions defaults() {
        return all(10, 30);
    }
}
