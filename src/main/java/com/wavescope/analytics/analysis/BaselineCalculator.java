package com.wavescope.analytics.analysis;

import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.stats.SeriesMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Computes baseline statistics over the wave scores of a series.
 */
@Component
@Slf4j
public class BaselineCalculator {

    public static final int MIN_POINTS = 5;

    /**
     * @return empty when the series has fewer than {@value #MIN_POINTS} points
     */
    public Optional<BaselineStatistics> compute(TrendSeries series) {
        if (series == null || series.size() < MIN_POINTS) {
            log.debug("Insufficient data for baseline: {} ({} points)",
                    series != null ? series.getTrendId() : null, series != null ? series.size() : 0);
            return Optional.empty();
        }
        return Optional.of(of(series.waveScores()));
    }

    /**
     * Statistics over arbitrary values, without a minimum size.
     */
    public static BaselineStatistics of(double[] values) {
        return new BaselineStatistics(
                SeriesMath.mean(values),
                SeriesMath.stdDev(values),
                SeriesMath.min(values),
                SeriesMath.max(values),
                values.length);
    }
}
