package com.wavescope.analytics.score;

/**
 * Alert severity of a viral score.
 */
public enum ViralSeverity {
    LOW(0),
    MEDIUM(70),
    HIGH(80),
    CRITICAL(90);

    private final int minScore;

    ViralSeverity(int minScore) {
        this.minScore = minScore;
    }

    public int getMinScore() {
        return minScore;
    }

    public static ViralSeverity of(double viralScore) {
        if (viralScore >= CRITICAL.minScore) return CRITICAL;
        if (viralScore >= HIGH.minScore) return HIGH;
        if (viralScore >= MEDIUM.minScore) return MEDIUM;
        return LOW;
    }
}
