package com.wavescope.analytics.variant;

public record PeerMetrics(String trendId, double maxWaveScore, double avgWaveScore, double totalReach) {
}
