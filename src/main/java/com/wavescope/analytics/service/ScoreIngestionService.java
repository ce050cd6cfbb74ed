package com.wavescope.analytics.service;

import com.wavescope.analytics.model.RawObservation;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.persistence.TrendStore;
import com.wavescope.analytics.score.CategoryViewBaseline;
import com.wavescope.analytics.score.GrowthMetrics;
import com.wavescope.analytics.score.TrendOutlook;
import com.wavescope.analytics.score.ViralScoreCalculator;
import com.wavescope.analytics.score.ViralSeverity;
import com.wavescope.analytics.score.WaveScoreCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores raw observations and stores them as ScorePoints.
 *
 * Flow per batch:
 * 1. View baselines are built per category from its stored points in the trailing
 *    baseline window plus the batch itself
 * 2. Each observation is scored and compared with the previous stored point of its trend
 * 3. The point is upserted together with its viral score
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoreIngestionService {

    private static final String UNCATEGORIZED = "uncategorized";

    private final WaveScoreCalculator scoreCalculator;
    private final ViralScoreCalculator viralCalculator;
    private final TrendStore trendStore;
    private final Clock clock;

    @Value("${analytics.score.baseline-hours:168}")
    private int baselineHours;

    public List<ScorePoint> ingest(List<RawObservation> observations) {
        return ingest(observations, LocalDateTime.now(clock));
    }

    public List<ScorePoint> ingest(List<RawObservation> observations, LocalDateTime now) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }

        List<RawObservation> valid = new ArrayList<>();
        for (RawObservation observation : observations) {
            if (observation == null || observation.getContentId() == null || observation.getPlatformSource() == null) {
                log.warn("Skipping observation without content id or platform: {}", observation);
                continue;
            }
            valid.add(observation);
        }
        // Chronological order so each point sees its predecessor from the same batch
        valid.sort(Comparator.comparing(o -> o.getObservedAt() != null ? o.getObservedAt() : now));

        Map<String, CategoryViewBaseline> baselines = categoryBaselines(valid, now);

        List<ScorePoint> stored = new ArrayList<>();
        int viralCandidates = 0;
        for (RawObservation observation : valid) {
            CategoryViewBaseline baseline = baselines.get(categoryKey(observation));
            ScorePoint point = scoreCalculator.score(observation, baseline, now);

            ScorePoint previous = trendStore.findLatestPoint(point.getTrendId(), point.getTimestamp()).orElse(null);
            double ageHours = WaveScoreCalculator.ageHours(observation.getPublishedAt(), point.getTimestamp());
            GrowthMetrics growth = viralCalculator.growthMetrics(point.getRawMetrics(), point.getTimestamp(), ageHours, previous);
            double viralScore = viralCalculator.viralScore(growth);

            if (viralCalculator.isViralCandidate(viralScore)) {
                viralCandidates++;
                logViralCandidate(point, growth, viralScore);
            }

            stored.add(trendStore.upsertScorePoint(point.toBuilder().viralScore(viralScore).build()));
        }

        log.info("Ingested {} observations ({} skipped, {} viral candidates)",
                stored.size(), observations.size() - valid.size(), viralCandidates);
        return stored;
    }

    private void logViralCandidate(ScorePoint point, GrowthMetrics growth, double viralScore) {
        List<Double> history = trendStore.findRecentViralScores(point.getTrendId(), point.getTimestamp());
        TrendOutlook outlook = viralCalculator.outlook(growth, history);
        log.info("Viral candidate {}: score={} severity={} outlook={} ({}%), peak in ~{}h {}",
                point.getTrendId(),
                String.format("%.0f", viralScore),
                ViralSeverity.of(viralScore),
                outlook.direction(),
                outlook.confidence(),
                outlook.hoursToPeak(),
                outlook.riskFactors().isEmpty() ? "" : outlook.riskFactors());
    }

    private Map<String, CategoryViewBaseline> categoryBaselines(List<RawObservation> observations, LocalDateTime now) {
        Map<String, List<RawObservation>> byCategory = new HashMap<>();
        for (RawObservation observation : observations) {
            byCategory.computeIfAbsent(categoryKey(observation), k -> new ArrayList<>()).add(observation);
        }

        LocalDateTime from = now.minusHours(baselineHours);
        Map<String, CategoryViewBaseline> baselines = new HashMap<>();
        byCategory.forEach((key, members) -> {
            // Stored rows of points being re-ingested are replaced by their batch values
            Set<String> batchKeys = new HashSet<>();
            List<Long> views = new ArrayList<>();
            for (RawObservation member : members) {
                batchKeys.add(pointKey(member.getTrendId(), member.getObservedAt() != null ? member.getObservedAt() : now));
                views.add(member.toRawMetrics().views());
            }
            int stored = 0;
            for (ScorePoint point : trendStore.queryCategoryPoints(members.get(0).getCategory(), from, now)) {
                if (!batchKeys.contains(pointKey(point.getTrendId(), point.getTimestamp()))) {
                    views.add(point.getRawMetrics().views());
                    stored++;
                }
            }
            CategoryViewBaseline baseline = CategoryViewBaseline.ofViews(views);
            log.debug("View baseline for {}: mean={} stdDev={} ({} stored, {} in batch)",
                    key, baseline.getMean(), baseline.getStdDev(), stored, members.size());
            baselines.put(key, baseline);
        });
        return baselines;
    }

    private static String pointKey(String trendId, LocalDateTime timestamp) {
        return trendId + "|" + timestamp;
    }

    private static String categoryKey(RawObservation observation) {
        return Objects.requireNonNullElse(observation.getCategory(), UNCATEGORIZED);
    }
}
