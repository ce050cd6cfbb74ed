package com.wavescope.analytics.service;

import com.wavescope.analytics.BaseIntegrationTest;
import com.wavescope.analytics.model.RawObservation;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.persistence.ScorePointRepository;
import com.wavescope.analytics.persistence.TrendStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Integration tests for ScoreIngestionService.
 */
@DisplayName("ScoreIngestionService Tests")
class ScoreIngestionServiceTest extends BaseIntegrationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Autowired
    private ScoreIngestionService ingestionService;

    @Autowired
    private TrendStore trendStore;

    @Autowired
    private ScorePointRepository scorePointRepository;

    @BeforeEach
    void setUp() {
        scorePointRepository.deleteAll();
    }

    private static RawObservation observation(String contentId, LocalDateTime observedAt, long views, long shares) {
        return RawObservation.builder()
                .contentId(contentId)
                .platformSource("youtube")
                .category("music")
                .publishedAt(NOW.minusHours(6))
                .observedAt(observedAt)
                .views(views)
                .likes(views / 20)
                .comments(views / 100)
                .shares(shares)
                .build();
    }

    @Test
    @DisplayName("Observations are scored and stored per trend")
    void observationsStored() {
        // Given
        List<RawObservation> batch = List.of(
                observation("a", NOW.minusHours(1), 10_000, 10),
                observation("b", NOW.minusHours(1), 2_000, 1));

        // When
        List<ScorePoint> stored = ingestionService.ingest(batch, NOW);

        // Then
        assertThat(stored).hasSize(2);
        assertThat(stored).allSatisfy(p -> {
            assertThat(p.getWaveScore()).isBetween(0.0, 100.0);
            assertThat(p.getViralScore()).isNotNull();
        });
        assertThat(trendStore.findTrendIds(NOW.minusDays(1), NOW)).containsExactly("youtube_a", "youtube_b");
    }

    @Test
    @DisplayName("Observations without identity are skipped")
    void invalidSkipped() {
        List<RawObservation> batch = new ArrayList<>();
        batch.add(observation("a", NOW, 1_000, 0));
        batch.add(RawObservation.builder().platformSource("youtube").views(5L).build());
        batch.add(null);

        List<ScorePoint> stored = ingestionService.ingest(batch, NOW);

        assertThat(stored).hasSize(1);
        assertThat(scorePointRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Later observation measures growth against the earlier one")
    void growthAgainstPrevious() {
        // Given: out of order input, 100k views gained in one hour
        List<RawObservation> batch = List.of(
                observation("a", NOW, 200_000, 500),
                observation("a", NOW.minusHours(1), 100_000, 100));

        // When
        List<ScorePoint> stored = ingestionService.ingest(batch, NOW);

        // Then
        assertThat(stored).extracting(ScorePoint::getTimestamp).containsExactly(NOW.minusHours(1), NOW);
        assertThat(stored.get(1).getViralScore()).isGreaterThan(stored.get(0).getViralScore());
        assertThat(trendStore.querySeries("youtube_a", NOW.minusDays(1), NOW).size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Re-ingesting the same batch is idempotent")
    void reingestIdempotent() {
        List<RawObservation> batch = List.of(observation("a", NOW.minusHours(2), 5_000, 5));

        List<ScorePoint> first = ingestionService.ingest(batch, NOW);
        List<ScorePoint> second = ingestionService.ingest(batch, NOW);

        assertThat(scorePointRepository.count()).isEqualTo(1);
        assertThat(second.get(0).getWaveScore()).isEqualTo(first.get(0).getWaveScore());
    }

    @Test
    @DisplayName("Single observations are scored against stored points of their category")
    void singleObservationUsesStoredCategoryBaseline() {
        // Given: five music points ingested one at a time
        for (int i = 0; i < 5; i++) {
            ingestionService.ingest(List.of(observation("m" + i, NOW.minusHours(5 - i), 1_000 + 100L * i, 1)), NOW);
        }

        // When
        ScorePoint small = ingestionService.ingest(List.of(observation("small", NOW, 50, 0)), NOW).get(0);
        ScorePoint huge = ingestionService.ingest(List.of(observation("huge", NOW, 50_000_000, 0)), NOW).get(0);

        // Then
        assertThat(small.getComponents().views()).isLessThan(50.0);
        assertThat(huge.getComponents().views()).isGreaterThan(50.0);
        assertThat(small.getConfidence()).isCloseTo(0.88, within(1e-9));
        assertThat(huge.getConfidence()).isCloseTo(0.88, within(1e-9));
    }

    @Test
    @DisplayName("First observation of a category has a neutral views component")
    void firstObservationIsNeutral() {
        ScorePoint point = ingestionService.ingest(List.of(observation("a", NOW, 5_000, 1)), NOW).get(0);

        assertThat(point.getComponents().views()).isEqualTo(50.0);
        assertThat(point.getConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Stored points outside the baseline window are ignored")
    void oldPointsOutsideBaseline() {
        // Given: stored eight days ago, beyond the 168h window
        LocalDateTime old = NOW.minusDays(8);
        ingestionService.ingest(List.of(observation("old1", old, 100, 1)), old);
        ingestionService.ingest(List.of(observation("old2", old.plusHours(1), 9_000, 1)), old.plusHours(1));

        // When
        ScorePoint point = ingestionService.ingest(List.of(observation("a", NOW, 5_000, 1)), NOW).get(0);

        // Then
        assertThat(point.getComponents().views()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Empty batch stores nothing")
    void emptyBatch() {
        assertThat(ingestionService.ingest(List.of(), NOW)).isEmpty();
        assertThat(ingestionService.ingest(null, NOW)).isEmpty();
    }
}
