package com.wavescope.analytics.analysis;

/**
 * Severity levels in ascending order.
 */
public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(AnomalySeverity other) {
        return compareTo(other) >= 0;
    }
}
