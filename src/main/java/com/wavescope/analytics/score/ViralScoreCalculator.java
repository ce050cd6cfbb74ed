package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.stats.SeriesMath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Growth velocity and viral potential of a single observation.
 *
 * Velocities are measured against the previous stored observation of the same trend,
 * or against the content age when there is none.
 */
@Component
public class ViralScoreCalculator {

    public static final double VIRAL_CANDIDATE_THRESHOLD = 70.0;

    private static final double RECENCY_HORIZON_HOURS = 48.0;
    private static final double MIN_RECENCY = 0.1;

    // Outlook thresholds
    private static final double HIGH_VIEW_VELOCITY = 5000;
    private static final double LOW_VIEW_VELOCITY = 100;
    private static final double HIGH_ENGAGEMENT_RATE = 0.05;
    private static final double LOW_ENGAGEMENT_RATE = 0.01;
    private static final double SUSPICIOUS_ENGAGEMENT_RATE = 0.15;
    private static final double EXTREME_VIEW_VELOCITY = 50_000;

    public GrowthMetrics growthMetrics(RawMetrics current, LocalDateTime observedAt, double ageHours,
                                       ScorePoint previous) {
        double hours;
        RawMetrics base;
        if (previous != null && previous.getRawMetrics() != null && previous.getTimestamp().isBefore(observedAt)) {
            hours = Duration.between(previous.getTimestamp(), observedAt).toMillis() / 3_600_000.0;
            base = previous.getRawMetrics();
        } else {
            hours = Math.max(ageHours, 1.0);
            base = RawMetrics.EMPTY;
        }

        double viewVelocity = Math.max(0, (current.views() - base.views()) / hours);
        double likeVelocity = Math.max(0, (current.likes() - base.likes()) / hours);
        double commentVelocity = Math.max(0, (current.comments() - base.comments()) / hours);
        double shareAcceleration = Math.max(0, (current.shares() - base.shares()) / hours);

        double engagementRate = current.views() > 0
                ? (double) (current.likes() + current.comments() + current.shares()) / current.views()
                : 0.0;
        double recency = SeriesMath.clamp((RECENCY_HORIZON_HOURS - ageHours) / RECENCY_HORIZON_HOURS, MIN_RECENCY, 1.0);

        return new GrowthMetrics(viewVelocity, likeVelocity, commentVelocity, shareAcceleration,
                engagementRate, recency, ageHours);
    }

    /**
     * Viral score 0..100 from velocity, sharing, engagement and discussion, decayed by recency.
     */
    public double viralScore(GrowthMetrics metrics) {
        double velocityScore = Math.min(100, metrics.viewVelocity() / 1000) * 0.4;
        double shareScore = Math.min(100, metrics.shareAcceleration() * 10) * 0.3;
        double engagementScore = Math.min(100, metrics.engagementRate() * 1000) * 0.2;
        double discussionScore = Math.min(100, metrics.commentVelocity() * 5) * 0.1;

        double score = (velocityScore + shareScore + engagementScore + discussionScore) * metrics.recencyMultiplier();
        return SeriesMath.clampScore(Math.round(score));
    }

    /**
     * Direction, confidence and peak estimate.
     *
     * @param recentViralScores previous viral scores of the trend in chronological order
     */
    public TrendOutlook outlook(GrowthMetrics metrics, List<Double> recentViralScores) {
        TrendOutlook.Direction direction = TrendOutlook.Direction.STABLE;
        int confidence = 50;
        List<String> reasons = new ArrayList<>();

        if (metrics.viewVelocity() > HIGH_VIEW_VELOCITY) {
            direction = TrendOutlook.Direction.RISING;
            confidence += 20;
            reasons.add("High view velocity");
        } else if (metrics.viewVelocity() < LOW_VIEW_VELOCITY) {
            direction = TrendOutlook.Direction.DECLINING;
            confidence -= 15;
            reasons.add("Low view velocity");
        }

        if (metrics.engagementRate() > HIGH_ENGAGEMENT_RATE) {
            if (direction == TrendOutlook.Direction.RISING) confidence += 15;
            reasons.add("High engagement rate");
        } else if (metrics.engagementRate() < LOW_ENGAGEMENT_RATE) {
            direction = TrendOutlook.Direction.DECLINING;
            confidence -= 10;
            reasons.add("Low engagement rate");
        }

        if (metrics.ageHours() < 6) {
            if (direction == TrendOutlook.Direction.RISING) {
                confidence += 10;
                reasons.add("Fresh content with momentum");
            }
        } else if (metrics.ageHours() > 72 && direction != TrendOutlook.Direction.RISING) {
            confidence += 5;
            reasons.add("Mature content past peak");
        }

        if (recentViralScores != null && recentViralScores.size() >= 3) {
            List<Double> lastThree = recentViralScores.subList(recentViralScores.size() - 3, recentViralScores.size());
            boolean accelerating = lastThree.get(1) >= lastThree.get(0) && lastThree.get(2) >= lastThree.get(1);
            if (accelerating && direction == TrendOutlook.Direction.RISING) {
                confidence += 15;
                reasons.add("Consistent growth pattern");
            } else if (!accelerating && direction == TrendOutlook.Direction.DECLINING) {
                confidence += 10;
                reasons.add("Declining trend confirmed");
            }
        }

        return new TrendOutlook(
                direction,
                Math.max(0, Math.min(100, confidence)),
                List.copyOf(reasons),
                hoursToPeak(metrics),
                riskFactors(metrics));
    }

    int hoursToPeak(GrowthMetrics metrics) {
        int age = (int) Math.floor(metrics.ageHours());
        if (metrics.viewVelocity() > 10_000) {
            return Math.max(6, 24 - age);
        }
        if (metrics.viewVelocity() > 1_000) {
            return Math.max(12, 72 - age);
        }
        return Math.max(24, 168 - age);
    }

    List<String> riskFactors(GrowthMetrics metrics) {
        List<String> risks = new ArrayList<>();
        if (metrics.engagementRate() > SUSPICIOUS_ENGAGEMENT_RATE) {
            risks.add("Unusually high engagement rate - potential artificial inflation");
        }
        if (metrics.viewVelocity() > EXTREME_VIEW_VELOCITY) {
            risks.add("Extremely rapid growth may trigger platform review");
        }
        return risks;
    }

    public boolean isViralCandidate(double viralScore) {
        return viralScore >= VIRAL_CANDIDATE_THRESHOLD;
    }
}
