package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawMetrics;
import org.springframework.stereotype.Component;

/**
 * Sentiment proxy based on the share of likes among likes and comments.
 * No text analysis is performed; content without any reaction is neutral (50).
 */
@Component
public class LikeRatioSentimentEstimator implements SentimentEstimator {

    private static final double NEUTRAL = 50.0;

    @Override
    public double estimate(RawMetrics metrics) {
        long reactions = metrics.likes() + metrics.comments();
        if (reactions == 0) {
            return NEUTRAL;
        }
        return (double) metrics.likes() / reactions * 100.0;
    }
}
