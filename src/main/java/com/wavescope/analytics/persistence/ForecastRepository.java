package com.wavescope.analytics.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ForecastRepository extends JpaRepository<ForecastEntity, Long> {

    Optional<ForecastEntity> findByTrendIdAndForecastOriginAndHoursAhead(
            String trendId, LocalDateTime forecastOrigin, Integer hoursAhead);

    List<ForecastEntity> findByTrendIdAndForecastOriginOrderByHoursAheadAsc(String trendId, LocalDateTime forecastOrigin);

    /**
     * Any row of the most recent forecast of a trend.
     */
    Optional<ForecastEntity> findTopByTrendIdOrderByForecastOriginDesc(String trendId);

    /**
     * Remove rows beyond the current horizon when a forecast is regenerated with a shorter one.
     */
    long deleteByTrendIdAndForecastOriginAndHoursAheadGreaterThan(
            String trendId, LocalDateTime forecastOrigin, Integer hoursAhead);
}
