package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawObservation;
import com.wavescope.analytics.stats.SeriesMath;

import java.util.Collection;

/**
 * Mean and population standard deviation of views within one category.
 */
public final class CategoryViewBaseline {

    public static final CategoryViewBaseline NONE = new CategoryViewBaseline(0.0, 0.0, 0);

    private final double mean;
    private final double stdDev;
    private final int observations;

    private CategoryViewBaseline(double mean, double stdDev, int observations) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.observations = observations;
    }

    public static CategoryViewBaseline of(Collection<RawObservation> population) {
        if (population == null || population.isEmpty()) {
            return NONE;
        }
        return ofViews(population.stream()
                .map(o -> o.toRawMetrics().views())
                .toList());
    }

    /**
     * Baseline over plain view counts, e.g. stored points of the category plus the current batch.
     */
    public static CategoryViewBaseline ofViews(Collection<Long> population) {
        if (population == null || population.isEmpty()) {
            return NONE;
        }
        double[] views = population.stream()
                .mapToDouble(Long::doubleValue)
                .toArray();
        return new CategoryViewBaseline(SeriesMath.mean(views), SeriesMath.stdDev(views), views.length);
    }

    public static CategoryViewBaseline of(double mean, double stdDev, int observations) {
        return new CategoryViewBaseline(mean, stdDev, observations);
    }

    /**
     * Z-score of the given view count, 0 when the population has no spread.
     */
    public double zScore(long views) {
        if (observations < 2 || stdDev == 0.0) {
            return 0.0;
        }
        return (views - mean) / stdDev;
    }

    /**
     * True when the population is large enough to carry a spread.
     */
    public boolean isUsable() {
        return observations >= 2;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public int getObservations() {
        return observations;
    }
}
