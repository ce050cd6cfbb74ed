package com.wavescope.analytics.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScorePointRepository extends JpaRepository<ScorePointEntity, Long> {

    Optional<ScorePointEntity> findByTrendIdAndObservedAt(String trendId, LocalDateTime observedAt);

    /**
     * Latest observation of a trend strictly before the given time.
     */
    Optional<ScorePointEntity> findTopByTrendIdAndObservedAtBeforeOrderByObservedAtDesc(
            String trendId, LocalDateTime before);

    /**
     * Most recent viral scores of a trend before the given time, newest first.
     */
    List<ScorePointEntity> findTop3ByTrendIdAndObservedAtBeforeAndViralScoreIsNotNullOrderByObservedAtDesc(
            String trendId, LocalDateTime before);

    /**
     * Observations of one trend in a time range, oldest first.
     */
    @Query("SELECT s FROM ScorePointEntity s WHERE s.trendId = :trendId " +
           "AND s.observedAt >= :start AND s.observedAt <= :end ORDER BY s.observedAt ASC")
    List<ScorePointEntity> findSeries(@Param("trendId") String trendId,
                                      @Param("start") LocalDateTime start,
                                      @Param("end") LocalDateTime end);

    /**
     * Observations of all trends in a time range.
     */
    @Query("SELECT s FROM ScorePointEntity s WHERE s.observedAt >= :start AND s.observedAt <= :end " +
           "ORDER BY s.trendId ASC, s.observedAt ASC")
    List<ScorePointEntity> findWindow(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    @Query("SELECT DISTINCT s.trendId FROM ScorePointEntity s " +
           "WHERE s.observedAt >= :start AND s.observedAt <= :end ORDER BY s.trendId ASC")
    List<String> findTrendIdsBetween(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    /**
     * Trend ids of the same category, excluding the given trend and its content on other platforms.
     */
    @Query("SELECT DISTINCT s.trendId FROM ScorePointEntity s WHERE s.category = :category " +
           "AND s.trendId <> :trendId AND (s.contentId IS NULL OR s.contentId <> :contentId) " +
           "AND s.observedAt >= :start AND s.observedAt <= :end ORDER BY s.trendId ASC")
    List<String> findPeerTrendIds(@Param("category") String category,
                                  @Param("trendId") String trendId,
                                  @Param("contentId") String contentId,
                                  @Param("start") LocalDateTime start,
                                  @Param("end") LocalDateTime end,
                                  Pageable pageable);

    @Query("SELECT s FROM ScorePointEntity s WHERE s.trendId IN :trendIds " +
           "AND s.observedAt >= :start AND s.observedAt <= :end ORDER BY s.trendId ASC, s.observedAt ASC")
    List<ScorePointEntity> findSeriesForTrends(@Param("trendIds") Collection<String> trendIds,
                                               @Param("start") LocalDateTime start,
                                               @Param("end") LocalDateTime end);

    /**
     * Observations of one category in a time range, the population of its view baseline.
     */
    List<ScorePointEntity> findByCategoryAndObservedAtBetween(String category, LocalDateTime start, LocalDateTime end);

    List<ScorePointEntity> findByCategoryIsNullAndObservedAtBetween(LocalDateTime start, LocalDateTime end);

    long countByTrendId(String trendId);
}
