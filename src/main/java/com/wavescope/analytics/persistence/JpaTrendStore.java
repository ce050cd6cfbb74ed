package com.wavescope.analytics.persistence;

import com.google.common.util.concurrent.Striped;
import com.wavescope.analytics.analysis.Anomaly;
import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.forecast.ForecastPrediction;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.variant.Variant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * TrendStore backed by Spring Data JPA.
 *
 * Writes to the same conflict key are serialized by a striped lock, and each
 * write runs in its own transaction bounded by {@code analytics.store.timeout-seconds}.
 * A duplicate insert racing with another process is retried once, as an update.
 */
@Component
@Slf4j
public class JpaTrendStore implements TrendStore {

    private static final int LOCK_STRIPES = 64;

    private final ScorePointRepository scorePointRepository;
    private final AnomalyRepository anomalyRepository;
    private final ForecastRepository forecastRepository;
    private final VariantRepository variantRepository;
    private final ArtifactMapper mapper;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final Striped<Lock> keyLocks = Striped.lazyWeakLock(LOCK_STRIPES);

    public JpaTrendStore(ScorePointRepository scorePointRepository,
                         AnomalyRepository anomalyRepository,
                         ForecastRepository forecastRepository,
                         VariantRepository variantRepository,
                         ArtifactMapper mapper,
                         PlatformTransactionManager transactionManager,
                         @Value("${analytics.store.timeout-seconds:30}") int timeoutSeconds) {
        this.scorePointRepository = scorePointRepository;
        this.anomalyRepository = anomalyRepository;
        this.forecastRepository = forecastRepository;
        this.variantRepository = variantRepository;
        this.mapper = mapper;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setReadOnly(true);
    }

    // --- Queries ---

    @Override
    public TrendSeries querySeries(String trendId, LocalDateTime from, LocalDateTime to) {
        return read(() -> TrendSeries.of(trendId, scorePointRepository.findSeries(trendId, from, to).stream()
                .map(mapper::toScorePoint)
                .toList()));
    }

    @Override
    public Map<String, TrendSeries> queryWindow(LocalDateTime from, LocalDateTime to) {
        return read(() -> groupByTrend(scorePointRepository.findWindow(from, to)));
    }

    @Override
    public List<String> findTrendIds(LocalDateTime from, LocalDateTime to) {
        return read(() -> scorePointRepository.findTrendIdsBetween(from, to));
    }

    @Override
    public List<TrendSeries> queryPeers(String category, String excludeTrendId, String excludeContentId,
                                        LocalDateTime from, LocalDateTime to, int limit) {
        if (category == null || limit <= 0) {
            return List.of();
        }
        return read(() -> {
            List<String> peerIds = scorePointRepository.findPeerTrendIds(
                    category, excludeTrendId, excludeContentId != null ? excludeContentId : "",
                    from, to, PageRequest.of(0, limit));
            if (peerIds.isEmpty()) {
                return List.<TrendSeries>of();
            }
            return new ArrayList<>(groupByTrend(scorePointRepository.findSeriesForTrends(peerIds, from, to)).values());
        });
    }

    @Override
    public List<ScorePoint> queryCategoryPoints(String category, LocalDateTime from, LocalDateTime to) {
        return read(() -> (category != null
                ? scorePointRepository.findByCategoryAndObservedAtBetween(category, from, to)
                : scorePointRepository.findByCategoryIsNullAndObservedAtBetween(from, to))
                .stream()
                .map(mapper::toScorePoint)
                .toList());
    }

    @Override
    public Optional<ScorePoint> findLatestPoint(String trendId, LocalDateTime before) {
        return read(() -> scorePointRepository.findTopByTrendIdAndObservedAtBeforeOrderByObservedAtDesc(trendId, before)
                .map(mapper::toScorePoint));
    }

    @Override
    public List<Double> findRecentViralScores(String trendId, LocalDateTime before) {
        return read(() -> {
            List<ScorePointEntity> newestFirst = scorePointRepository
                    .findTop3ByTrendIdAndObservedAtBeforeAndViralScoreIsNotNullOrderByObservedAtDesc(trendId, before);
            List<Double> scores = new ArrayList<>();
            for (int i = newestFirst.size() - 1; i >= 0; i--) {
                scores.add(newestFirst.get(i).getViralScore());
            }
            return scores;
        });
    }

    @Override
    public List<Anomaly> findAnomalies(String trendId) {
        return read(() -> anomalyRepository.findByTrendIdOrderByDetectionTimestampAsc(trendId).stream()
                .map(mapper::toAnomaly)
                .toList());
    }

    @Override
    public List<Anomaly> findAnomaliesDetectedBetween(LocalDateTime from, LocalDateTime to) {
        return read(() -> anomalyRepository.findDetectedBetween(from, to).stream()
                .map(mapper::toAnomaly)
                .toList());
    }

    @Override
    public Optional<EnsembleForecast> findLatestForecast(String trendId) {
        return read(() -> forecastRepository.findTopByTrendIdOrderByForecastOriginDesc(trendId)
                .map(head -> forecastRepository.findByTrendIdAndForecastOriginOrderByHoursAheadAsc(
                        trendId, head.getForecastOrigin()))
                .filter(rows -> !rows.isEmpty())
                .map(mapper::toEnsembleForecast));
    }

    @Override
    public List<Variant> findVariants(String trendId) {
        return read(() -> variantRepository.findByTrendIdOrderByVariantTypeAscVariantNameAsc(trendId).stream()
                .map(mapper::toVariant)
                .toList());
    }

    // --- Upserts ---

    @Override
    public ScorePoint upsertScorePoint(ScorePoint point) {
        String key = point.getTrendId() + "|score|" + point.getTimestamp();
        return upsert(key, () -> {
            ScorePointEntity entity = scorePointRepository
                    .findByTrendIdAndObservedAt(point.getTrendId(), point.getTimestamp())
                    .orElseGet(ScorePointEntity::new);
            mapper.copy(point, entity);
            scorePointRepository.saveAndFlush(entity);
            log.debug("Score point stored: {} at {}", point.getTrendId(), point.getTimestamp());
            return point;
        });
    }

    @Override
    public int upsertAnomalies(List<Anomaly> anomalies) {
        int stored = 0;
        for (Anomaly anomaly : anomalies) {
            String key = anomaly.getTrendId() + "|anomaly|" + anomaly.getDetectionTimestamp() + "|" + anomaly.getAnomalyType();
            upsert(key, () -> {
                AnomalyEntity entity = anomalyRepository
                        .findByTrendIdAndDetectionTimestampAndAnomalyType(
                                anomaly.getTrendId(), anomaly.getDetectionTimestamp(), anomaly.getAnomalyType())
                        .orElseGet(AnomalyEntity::new);
                mapper.copy(anomaly, entity);
                anomalyRepository.saveAndFlush(entity);
                return entity;
            });
            stored++;
        }
        log.debug("Stored {} anomalies", stored);
        return stored;
    }

    @Override
    public int upsertForecast(EnsembleForecast forecast) {
        String key = forecast.getTrendId() + "|forecast|" + forecast.getForecastOrigin();
        return upsert(key, () -> {
            for (ForecastPrediction prediction : forecast.getPredictions()) {
                ForecastEntity entity = forecastRepository
                        .findByTrendIdAndForecastOriginAndHoursAhead(
                                forecast.getTrendId(), forecast.getForecastOrigin(), prediction.hoursAhead())
                        .orElseGet(ForecastEntity::new);
                mapper.copy(forecast, prediction, entity);
                forecastRepository.save(entity);
            }
            long removed = forecastRepository.deleteByTrendIdAndForecastOriginAndHoursAheadGreaterThan(
                    forecast.getTrendId(), forecast.getForecastOrigin(), forecast.getPredictions().size());
            forecastRepository.flush();
            log.debug("Forecast stored: {} origin {} ({} rows, {} stale removed)",
                    forecast.getTrendId(), forecast.getForecastOrigin(), forecast.getPredictions().size(), removed);
            return forecast.getPredictions().size();
        });
    }

    @Override
    public int upsertVariants(List<Variant> variants) {
        int stored = 0;
        for (Variant variant : variants) {
            String key = variant.getTrendId() + "|variant|" + variant.getVariantType() + "|" + variant.getVariantName();
            upsert(key, () -> {
                VariantEntity entity = variantRepository
                        .findByTrendIdAndVariantTypeAndVariantName(
                                variant.getTrendId(), variant.getVariantType(), variant.getVariantName())
                        .orElseGet(VariantEntity::new);
                mapper.copy(variant, entity);
                variantRepository.saveAndFlush(entity);
                return entity;
            });
            stored++;
        }
        log.debug("Stored {} variants", stored);
        return stored;
    }

    private <T> T upsert(String key, Supplier<T> write) {
        Lock lock = keyLocks.get(key);
        lock.lock();
        try {
            try {
                return writeTemplate.execute(status -> write.get());
            } catch (DataIntegrityViolationException e) {
                // Row inserted concurrently by another writer; now it exists and is updated
                log.debug("Duplicate insert for {}, retrying as update", key);
                return writeTemplate.execute(status -> write.get());
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        return readTemplate.execute(status -> query.get());
    }

    private Map<String, TrendSeries> groupByTrend(List<ScorePointEntity> rows) {
        Map<String, List<ScorePoint>> grouped = new LinkedHashMap<>();
        for (ScorePointEntity row : rows) {
            grouped.computeIfAbsent(row.getTrendId(), id -> new ArrayList<>()).add(mapper.toScorePoint(row));
        }
        Map<String, TrendSeries> series = new LinkedHashMap<>();
        grouped.forEach((trendId, points) -> series.put(trendId, TrendSeries.of(trendId, points)));
        return series;
    }
}
