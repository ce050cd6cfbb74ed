package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.RawObservation;
import com.wavescope.analytics.model.ScoreComponents;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.stats.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Turns one raw observation into a ScorePoint.
 *
 * WaveScore = 0.25*views + 0.30*engagement + 0.25*growth + 0.15*sentiment + 0.05*recency,
 * every sub-component clamped to [0, 100] before weighting.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WaveScoreCalculator {

    // Component weights
    private static final double VIEWS_WEIGHT = 0.25;
    private static final double ENGAGEMENT_WEIGHT = 0.30;
    private static final double GROWTH_WEIGHT = 0.25;
    private static final double SENTIMENT_WEIGHT = 0.15;
    private static final double RECENCY_WEIGHT = 0.05;

    private static final double ENGAGEMENT_SCALE = 1000.0; // 10% weighted engagement saturates
    private static final double GROWTH_REFERENCE_VPH = 1_000_000.0;
    private static final double VIEWS_CENTER = 50.0;
    private static final double VIEWS_Z_SCALE = 15.0;

    // Confidence parameters
    private static final double BASE_CONFIDENCE = 0.8;
    private static final double MIN_CONFIDENCE = 0.3;

    private final SentimentEstimator sentimentEstimator;

    /**
     * Score an observation against the view baseline of its category.
     * The age of the content is measured at observation time (or {@code now} when unknown).
     */
    public ScorePoint score(RawObservation observation, CategoryViewBaseline baseline, LocalDateTime now) {
        LocalDateTime observedAt = observation.getObservedAt() != null ? observation.getObservedAt() : now;
        RawMetrics metrics = observation.toRawMetrics();
        double ageHours = ageHours(observation.getPublishedAt(), observedAt);
        CategoryViewBaseline effectiveBaseline = baseline != null ? baseline : CategoryViewBaseline.NONE;

        ScoreComponents components = computeComponents(metrics, ageHours, effectiveBaseline);
        double waveScore = combine(components);
        double confidence = confidence(metrics, ageHours, effectiveBaseline, observation.getPlatformSource());

        log.debug("Scored {}: waveScore={}, confidence={}", observation.getTrendId(), waveScore, confidence);

        return ScorePoint.builder()
                .timestamp(observedAt)
                .trendId(observation.getTrendId())
                .contentId(observation.getContentId())
                .waveScore(waveScore)
                .confidence(confidence)
                .platformSource(observation.getPlatformSource())
                .category(observation.getCategory())
                .rawMetrics(metrics)
                .components(components)
                .build();
    }

    public ScoreComponents computeComponents(RawMetrics metrics, double ageHours, CategoryViewBaseline baseline) {
        return new ScoreComponents(
                SeriesMath.clampScore(viewsComponent(metrics.views(), baseline)),
                SeriesMath.clampScore(engagementComponent(metrics)),
                SeriesMath.clampScore(growthComponent(metrics.views(), ageHours)),
                SeriesMath.clampScore(sentimentEstimator.estimate(metrics)),
                SeriesMath.clampScore(recencyWeight(ageHours))
        );
    }

    /**
     * Weighted sum of the sub-components, rounded to 2 decimals and clamped.
     */
    public double combine(ScoreComponents c) {
        double raw = VIEWS_WEIGHT * c.views()
                + ENGAGEMENT_WEIGHT * c.engagement()
                + GROWTH_WEIGHT * c.growth()
                + SENTIMENT_WEIGHT * c.sentiment()
                + RECENCY_WEIGHT * c.recency();
        return SeriesMath.clampScore(SeriesMath.round2(raw));
    }

    /**
     * Weighted engagement rate (likes + 2*comments + 5*shares) / views.
     */
    public static double engagementRate(RawMetrics metrics) {
        double weighted = metrics.likes() + 2.0 * metrics.comments() + 5.0 * metrics.shares();
        return weighted / Math.max(metrics.views(), 1L);
    }

    double engagementComponent(RawMetrics metrics) {
        return Math.min(100.0, engagementRate(metrics) * ENGAGEMENT_SCALE);
    }

    double viewsComponent(long views, CategoryViewBaseline baseline) {
        return VIEWS_CENTER + VIEWS_Z_SCALE * baseline.zScore(views);
    }

    double growthComponent(long views, double ageHours) {
        double viewsPerHour = views / Math.max(ageHours, 1.0);
        double logScaled = Math.log10(viewsPerHour + 1.0) / Math.log10(GROWTH_REFERENCE_VPH + 1.0) * 100.0;
        return logScaled * ageFactor(ageHours);
    }

    static double ageFactor(double ageHours) {
        if (ageHours < 1) return 0.7;
        if (ageHours < 6) return 0.9;
        if (ageHours > 168) return 1.2;
        return 1.0;
    }

    /**
     * Step decay of freshness: 100 at publication down to 10 after 30 days.
     */
    public static double recencyWeight(double ageHours) {
        if (ageHours <= 0) return 100;
        if (ageHours <= 1) return 95;
        if (ageHours <= 6) return 85;
        if (ageHours <= 24) return 70;
        if (ageHours <= 168) return 50;
        if (ageHours <= 720) return 25;
        return 10;
    }

    double confidence(RawMetrics metrics, double ageHours, CategoryViewBaseline baseline, String platform) {
        double confidence = BASE_CONFIDENCE;
        if (!metrics.hasEngagement()) {
            confidence *= 0.7;
        }
        if (ageHours < 1) {
            confidence *= 0.6;
        }
        if (baseline.isUsable()) {
            confidence *= 1.1;
        }
        confidence *= platformReliability(platform);
        return SeriesMath.clamp(confidence, MIN_CONFIDENCE, 1.0);
    }

    static double platformReliability(String platform) {
        if (platform == null) return 1.0;
        return switch (platform.toLowerCase()) {
            case "reddit" -> 0.9;
            case "tiktok" -> 0.8;
            default -> 1.0;
        };
    }

    /**
     * Hours between publication and observation, never negative; 0 when publication time is unknown.
     */
    public static double ageHours(LocalDateTime publishedAt, LocalDateTime observedAt) {
        if (publishedAt == null || observedAt == null) {
            return 0.0;
        }
        double hours = Duration.between(publishedAt, observedAt).toMillis() / 3_600_000.0;
        return Math.max(0.0, hours);
    }
}
