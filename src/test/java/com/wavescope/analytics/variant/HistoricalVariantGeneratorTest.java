package com.wavescope.analytics.variant;

import com.wavescope.analytics.TestSeries;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wavescope.analytics.TestSeries.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("HistoricalVariantGenerator Tests")
class HistoricalVariantGeneratorTest {

    private static final TrendSeries LINEAR = TestSeries.hourly("youtube_a", 50, 52, 54, 56, 58, 60, 62, 64, 66, 68);
    private static final LocalDateTime NOW = LINEAR.last().getTimestamp();

    private final HistoricalVariantGenerator generator = new HistoricalVariantGenerator();

    private static Variant named(List<Variant> variants, String name) {
        return variants.stream().filter(v -> v.getVariantName().equals(name)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("Snapshots and aggregates")
    class HistoryTests {

        @Test
        @DisplayName("Snapshot picks the point closest to the look-back target")
        void snapshotClosestPoint() {
            List<Variant> variants = generator.generate(LINEAR, List.of(),
                    new VariantOptions(true, false, false, false, 10, 30), NOW);

            assertThat(variants).extracting(Variant::getVariantName).containsExactly(
                    "snapshot_1h_ago", "snapshot_6h_ago", "snapshot_24h_ago", "snapshot_7d_ago");

            SnapshotPayload sixHours = (SnapshotPayload) named(variants, "snapshot_6h_ago").getPayload();
            assertThat(sixHours.timestamp()).isEqualTo(NOW.minusHours(6));
            assertThat(sixHours.waveScore()).isEqualTo(56.0);

            // Beyond the history the earliest point is the closest
            SnapshotPayload week = (SnapshotPayload) named(variants, "snapshot_7d_ago").getPayload();
            assertThat(week.timestamp()).isEqualTo(START);
        }

        @Test
        @DisplayName("Closest point prefers the earlier one on a tie")
        void closestPointTie() {
            ScorePoint closest = HistoricalVariantGenerator.closestPoint(LINEAR, START.plusMinutes(30));

            assertThat(closest.getTimestamp()).isEqualTo(START);
        }

        @Test
        @DisplayName("Aggregates summarize every non-empty timeframe")
        void aggregates() {
            List<Variant> variants = generator.generate(LINEAR, List.of(),
                    new VariantOptions(false, true, false, false, 10, 30), NOW);

            assertThat(variants).hasSize(5);
            AggregatedPayload oneHour = (AggregatedPayload) named(variants, "aggregated_1h").getPayload();
            assertThat(oneHour.dataPoints()).isEqualTo(2);
            assertThat(oneHour.waveScore().avg()).isEqualTo(67.0);

            AggregatedPayload day = (AggregatedPayload) named(variants, "aggregated_24h").getPayload();
            assertThat(day.dataPoints()).isEqualTo(10);
            assertThat(day.timeSpanHours()).isEqualTo(9.0);
            assertThat(day.waveScore().trend()).isCloseTo(2.0, within(1e-9));
            assertThat(day.trendAnalysis().direction()).isEqualTo("rising");
            assertThat(day.trendAnalysis().velocity()).isCloseTo(2.0, within(1e-9));
            assertThat(day.trendAnalysis().acceleration()).isCloseTo(0.0, within(1e-9));
        }

        @Test
        @DisplayName("Single point window has no trend analysis")
        void singlePointWindow() {
            TrendSeries single = TestSeries.hourly("youtube_a", 42);

            AggregatedPayload payload = HistoricalVariantGenerator.aggregate(single);

            assertThat(payload.trendAnalysis()).isNull();
            assertThat(payload.dataPoints()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Projections")
    class ProjectionTests {

        @Test
        @DisplayName("Projection extends the fitted slope from the last value")
        void projectionExtendsSlope() {
            List<Variant> variants = generator.generate(LINEAR, List.of(),
                    new VariantOptions(false, false, true, false, 10, 30), NOW);

            assertThat(variants).hasSize(3);
            ProjectionPayload sixHours = (ProjectionPayload) named(variants, "projection_6h_ahead").getPayload();
            assertThat(sixHours.projectedWaveScore()).isCloseTo(80.0, within(1e-6));
            assertThat(sixHours.confidenceLevel()).isEqualTo(1.0);
            assertThat(sixHours.projectionHours()).isEqualTo(6);

            ProjectionPayload week = (ProjectionPayload) named(variants, "projection_7d_ahead").getPayload();
            assertThat(week.projectedWaveScore()).isEqualTo(100.0);
            assertThat(week.warningFlags()).contains("extreme_high_score");
            assertThat(named(variants, "projection_7d_ahead").getTimeRangeEnd()).isEqualTo(NOW.plusDays(7));
        }

        @Test
        @DisplayName("Single point gives no projection")
        void singlePointNoProjection() {
            List<Variant> variants = generator.generate(TestSeries.hourly("youtube_a", 42), List.of(),
                    new VariantOptions(false, false, true, false, 10, 30), NOW);

            assertThat(variants).isEmpty();
        }
    }

    @Nested
    @DisplayName("Comparisons")
    class ComparisonTests {

        @Test
        @DisplayName("Trend at 60 among peers 40, 60, 80 ranks second at the 66.67th percentile")
        void peerPercentile() {
            TrendSeries current = TestSeries.hourly("youtube_a", 30, 60, 50);
            List<TrendSeries> peers = List.of(
                    TestSeries.hourly("youtube_b", 20, 40),
                    TestSeries.hourly("youtube_c", 60, 10),
                    TestSeries.hourly("youtube_d", 80, 70));

            List<Variant> variants = generator.generate(current, peers,
                    new VariantOptions(false, false, false, true, 10, 30), NOW);

            Variant comparison = named(variants, "performance_comparison");
            PerformanceComparisonPayload payload = (PerformanceComparisonPayload) comparison.getPayload();
            assertThat(payload.waveScorePercentile()).isEqualTo(66.67);
            assertThat(payload.waveScoreRanking()).isEqualTo(2);
            assertThat(payload.peers()).hasSize(3);
            assertThat(comparison.getMetadata().comparedTrends())
                    .containsExactly("youtube_b", "youtube_c", "youtube_d");
        }

        @Test
        @DisplayName("No peers means no performance comparison")
        void noPeers() {
            List<Variant> variants = generator.generate(LINEAR, List.of(),
                    new VariantOptions(false, false, false, true, 10, 30), NOW);

            assertThat(variants).isEmpty();
        }

        @Test
        @DisplayName("Percentile of an empty dataset is 100")
        void emptyPercentile() {
            assertThat(HistoricalVariantGenerator.percentileRank(10, new double[0])).isEqualTo(100.0);
            assertThat(HistoricalVariantGenerator.ranking(10, new double[0])).isEqualTo(1);
        }

        @Test
        @DisplayName("Platform comparison covers every platform of the series")
        void platformComparison() {
            TrendSeries series = TrendSeries.of("cross_a", List.of(
                    TestSeries.point("cross_a", START, 40, "youtube", "music"),
                    TestSeries.point("cross_a", START.plusHours(1), 80, "tiktok", "music")));

            PlatformComparisonPayload payload = HistoricalVariantGenerator.platformComparison(series);

            assertThat(payload).isNotNull();
            assertThat(payload.byPlatform()).containsOnlyKeys("youtube", "tiktok");
            assertThat(payload.bestPerformingPlatform()).isEqualTo("tiktok");
            assertThat(payload.crossPlatformReach()).isEqualTo(2000.0);
            assertThat(payload.diversityScore()).isCloseTo(100.0, within(1e-9));
        }

        @Test
        @DisplayName("Diversity is zero when one platform holds all reach")
        void diversityConcentrated() {
            Map<String, PlatformStats> byPlatform = new LinkedHashMap<>();
            byPlatform.put("youtube", new PlatformStats(1, 50, 50, 1000, 10));
            byPlatform.put("tiktok", new PlatformStats(1, 50, 50, 0, 10));

            assertThat(HistoricalVariantGenerator.diversityScore(byPlatform, 1000)).isZero();
        }
    }

    @Test
    @DisplayName("Generation is idempotent for identical inputs")
    void idempotent() {
        List<TrendSeries> peers = List.of(TestSeries.hourly("youtube_b", 20, 40));

        List<Variant> first = generator.generate(LINEAR, peers, VariantOptions.defaults(), NOW);
        List<Variant> second = generator.generate(LINEAR, peers, VariantOptions.defaults(), NOW);

        assertThat(second).isEqualTo(first);
        assertThat(first).hasSize(4 + 5 + 3 + 1);
    }

    @Test
    @DisplayName("Empty series gives no variants")
    void emptySeries() {
        assertThat(generator.generate(TrendSeries.empty("youtube_a"), List.of(), VariantOptions.defaults(), NOW))
                .isEmpty();
    }
}
