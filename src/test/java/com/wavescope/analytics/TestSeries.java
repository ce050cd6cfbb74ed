package com.wavescope.analytics;

import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.ScoreComponents;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for hourly score series used across tests.
 */
public final class TestSeries {

    public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private TestSeries() {
    }

    public static TrendSeries hourly(String trendId, double... scores) {
        return TrendSeries.of(trendId, hourlyPoints(trendId, START, scores));
    }

    public static List<ScorePoint> hourlyPoints(String trendId, LocalDateTime start, double... scores) {
        List<ScorePoint> points = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            points.add(point(trendId, start.plusHours(i), scores[i]));
        }
        return points;
    }

    public static ScorePoint point(String trendId, LocalDateTime timestamp, double waveScore) {
        return point(trendId, timestamp, waveScore, "youtube", "music");
    }

    public static ScorePoint point(String trendId, LocalDateTime timestamp, double waveScore,
                                   String platform, String category) {
        return ScorePoint.builder()
                .timestamp(timestamp)
                .trendId(trendId)
                .contentId(trendId.substring(trendId.indexOf('_') + 1))
                .waveScore(waveScore)
                .confidence(0.8)
                .platformSource(platform)
                .category(category)
                .rawMetrics(new RawMetrics(1000, 50, 10, 5))
                .components(new ScoreComponents(50, 40, 30, 80, 70))
                .build();
    }
}
