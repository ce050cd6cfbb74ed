package com.wavescope.analytics.score;

import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.ScorePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ViralScoreCalculator Tests")
class ViralScoreCalculatorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    private final ViralScoreCalculator calculator = new ViralScoreCalculator();

    @Nested
    @DisplayName("Growth metrics")
    class GrowthTests {

        @Test
        @DisplayName("Velocity is measured against the previous observation")
        void velocityAgainstPrevious() {
            ScorePoint previous = ScorePoint.builder()
                    .timestamp(NOW.minusHours(2))
                    .trendId("youtube_a")
                    .rawMetrics(new RawMetrics(10_000, 100, 10, 4))
                    .build();

            GrowthMetrics growth = calculator.growthMetrics(new RawMetrics(30_000, 300, 50, 24), NOW, 10, previous);

            assertThat(growth.viewVelocity()).isEqualTo(10_000.0);
            assertThat(growth.likeVelocity()).isEqualTo(100.0);
            assertThat(growth.commentVelocity()).isEqualTo(20.0);
            assertThat(growth.shareAcceleration()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Without a previous observation the content age is used")
        void velocityAgainstAge() {
            GrowthMetrics growth = calculator.growthMetrics(new RawMetrics(8_000, 0, 0, 0), NOW, 4, null);

            assertThat(growth.viewVelocity()).isEqualTo(2_000.0);
        }

        @Test
        @DisplayName("Shrinking counters give zero velocity")
        void shrinkingCounters() {
            ScorePoint previous = ScorePoint.builder()
                    .timestamp(NOW.minusHours(1))
                    .rawMetrics(new RawMetrics(5_000, 50, 5, 5))
                    .build();

            GrowthMetrics growth = calculator.growthMetrics(new RawMetrics(4_000, 40, 4, 4), NOW, 10, previous);

            assertThat(growth.viewVelocity()).isZero();
            assertThat(growth.shareAcceleration()).isZero();
        }

        @Test
        @DisplayName("Recency multiplier decays over 48 hours with a floor")
        void recencyMultiplier() {
            assertThat(calculator.growthMetrics(RawMetrics.EMPTY, NOW, 0, null).recencyMultiplier()).isEqualTo(1.0);
            assertThat(calculator.growthMetrics(RawMetrics.EMPTY, NOW, 24, null).recencyMultiplier()).isEqualTo(0.5);
            assertThat(calculator.growthMetrics(RawMetrics.EMPTY, NOW, 100, null).recencyMultiplier()).isEqualTo(0.1);
        }
    }

    @Nested
    @DisplayName("Viral score")
    class ScoreTests {

        @Test
        @DisplayName("Saturated inputs reach 100")
        void saturatedInputs() {
            GrowthMetrics growth = new GrowthMetrics(200_000, 0, 100, 50, 0.2, 1.0, 1);

            assertThat(calculator.viralScore(growth)).isEqualTo(100.0);
            assertThat(calculator.isViralCandidate(100.0)).isTrue();
            assertThat(ViralSeverity.of(100.0)).isEqualTo(ViralSeverity.CRITICAL);
        }

        @Test
        @DisplayName("Score is scaled by recency")
        void scaledByRecency() {
            GrowthMetrics fresh = new GrowthMetrics(50_000, 0, 0, 0, 0, 1.0, 0);
            GrowthMetrics stale = new GrowthMetrics(50_000, 0, 0, 0, 0, 0.5, 24);

            assertThat(calculator.viralScore(fresh)).isEqualTo(20.0);
            assertThat(calculator.viralScore(stale)).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Severity thresholds")
        void severityThresholds() {
            assertThat(ViralSeverity.of(69.9)).isEqualTo(ViralSeverity.LOW);
            assertThat(ViralSeverity.of(70)).isEqualTo(ViralSeverity.MEDIUM);
            assertThat(ViralSeverity.of(85)).isEqualTo(ViralSeverity.HIGH);
        }
    }

    @Nested
    @DisplayName("Outlook")
    class OutlookTests {

        @Test
        @DisplayName("Fast fresh content is rising with an early peak")
        void risingOutlook() {
            GrowthMetrics growth = new GrowthMetrics(20_000, 0, 0, 0, 0.08, 1.0, 2);

            TrendOutlook outlook = calculator.outlook(growth, List.of(40.0, 50.0, 60.0));

            assertThat(outlook.direction()).isEqualTo(TrendOutlook.Direction.RISING);
            // 50 + 20 + 15 + 10 + 15
            assertThat(outlook.confidence()).isEqualTo(100);
            assertThat(outlook.hoursToPeak()).isEqualTo(22);
            assertThat(outlook.reasons()).contains("Consistent growth pattern");
        }

        @Test
        @DisplayName("Slow content with low engagement is declining")
        void decliningOutlook() {
            GrowthMetrics growth = new GrowthMetrics(50, 0, 0, 0, 0.001, 0.1, 100);

            TrendOutlook outlook = calculator.outlook(growth, List.of(60.0, 50.0, 40.0));

            assertThat(outlook.direction()).isEqualTo(TrendOutlook.Direction.DECLINING);
            // 50 - 15 - 10 + 5 + 10
            assertThat(outlook.confidence()).isEqualTo(40);
            assertThat(outlook.hoursToPeak()).isEqualTo(68);
        }

        @Test
        @DisplayName("Suspicious engagement is flagged as a risk")
        void riskFactors() {
            GrowthMetrics growth = new GrowthMetrics(60_000, 0, 0, 0, 0.3, 1.0, 1);

            assertThat(calculator.riskFactors(growth)).hasSize(2);
            assertThat(calculator.hoursToPeak(growth)).isEqualTo(23);
        }
    }

    @Test
    @DisplayName("Engagement rate uses likes comments and shares over views")
    void engagementRate() {
        GrowthMetrics growth = calculator.growthMetrics(new RawMetrics(1_000, 30, 10, 10), NOW, 1, null);

        assertThat(growth.engagementRate()).isCloseTo(0.05, within(1e-9));
    }
}
