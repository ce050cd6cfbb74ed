package com.wavescope.analytics.persistence;

import com.wavescope.analytics.analysis.AnomalyType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnomalyRepository extends JpaRepository<AnomalyEntity, Long> {

    Optional<AnomalyEntity> findByTrendIdAndDetectionTimestampAndAnomalyType(
            String trendId, LocalDateTime detectionTimestamp, AnomalyType anomalyType);

    List<AnomalyEntity> findByTrendIdOrderByDetectionTimestampAsc(String trendId);

    @Query("SELECT a FROM AnomalyEntity a WHERE a.detectionTimestamp >= :start AND a.detectionTimestamp <= :end " +
           "ORDER BY a.detectionTimestamp ASC")
    List<AnomalyEntity> findDetectedBetween(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);
}
