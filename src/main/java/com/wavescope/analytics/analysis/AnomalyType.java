package com.wavescope.analytics.analysis;

public enum AnomalyType {
    SPIKE,
    DROP,
    UNUSUAL_PATTERN
}
