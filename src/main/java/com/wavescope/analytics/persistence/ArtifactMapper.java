package com.wavescope.analytics.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.wavescope.analytics.analysis.Anomaly;
import com.wavescope.analytics.analysis.AnomalyMetadata;
import com.wavescope.analytics.forecast.EnsembleForecast;
import com.wavescope.analytics.forecast.ForecastModelType;
import com.wavescope.analytics.forecast.ForecastPrediction;
import com.wavescope.analytics.model.RawMetrics;
import com.wavescope.analytics.model.ScoreComponents;
import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.variant.Variant;
import com.wavescope.analytics.variant.VariantMetadata;
import com.wavescope.analytics.variant.VariantPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Copies domain artifacts onto entities and back. Entity ids and audit columns are never touched,
 * so an existing row can be overwritten in place.
 */
@Component
@RequiredArgsConstructor
public class ArtifactMapper {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ForecastModelType>> MODEL_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<ForecastModelType, Double>> WEIGHT_MAP = new TypeReference<>() {};

    private final JsonPayloadConverter json;

    // --- Score points ---

    public void copy(ScorePoint point, ScorePointEntity entity) {
        entity.setTrendId(point.getTrendId());
        entity.setContentId(point.getContentId());
        entity.setObservedAt(point.getTimestamp());
        entity.setWaveScore(point.getWaveScore());
        entity.setConfidence(point.getConfidence());
        entity.setPlatformSource(point.getPlatformSource());
        entity.setCategory(point.getCategory());

        RawMetrics metrics = point.getRawMetrics() != null ? point.getRawMetrics() : RawMetrics.EMPTY;
        entity.setViews(metrics.views());
        entity.setLikes(metrics.likes());
        entity.setComments(metrics.comments());
        entity.setShares(metrics.shares());

        ScoreComponents components = point.getComponents();
        entity.setViewsComponent(components != null ? components.views() : null);
        entity.setEngagementComponent(components != null ? components.engagement() : null);
        entity.setGrowthComponent(components != null ? components.growth() : null);
        entity.setSentimentComponent(components != null ? components.sentiment() : null);
        entity.setRecencyComponent(components != null ? components.recency() : null);

        entity.setViralScore(point.getViralScore());
    }

    public ScorePoint toScorePoint(ScorePointEntity entity) {
        ScoreComponents components = null;
        if (entity.getViewsComponent() != null && entity.getEngagementComponent() != null
                && entity.getGrowthComponent() != null && entity.getSentimentComponent() != null
                && entity.getRecencyComponent() != null) {
            components = new ScoreComponents(
                    entity.getViewsComponent(),
                    entity.getEngagementComponent(),
                    entity.getGrowthComponent(),
                    entity.getSentimentComponent(),
                    entity.getRecencyComponent());
        }

        return ScorePoint.builder()
                .timestamp(entity.getObservedAt())
                .trendId(entity.getTrendId())
                .contentId(entity.getContentId())
                .waveScore(orZero(entity.getWaveScore()))
                .confidence(orZero(entity.getConfidence()))
                .platformSource(entity.getPlatformSource())
                .category(entity.getCategory())
                .rawMetrics(RawMetrics.of(entity.getViews(), entity.getLikes(), entity.getComments(), entity.getShares()))
                .components(components)
                .viralScore(entity.getViralScore())
                .build();
    }

    // --- Anomalies ---

    public void copy(Anomaly anomaly, AnomalyEntity entity) {
        entity.setTrendId(anomaly.getTrendId());
        entity.setDetectionTimestamp(anomaly.getDetectionTimestamp());
        entity.setAnomalyType(anomaly.getAnomalyType());
        entity.setSeverity(anomaly.getSeverity());
        entity.setAnomalyScore(anomaly.getAnomalyScore());
        entity.setBaselineValue(anomaly.getBaselineValue());
        entity.setAnomalyValue(anomaly.getAnomalyValue());
        entity.setThresholdExceeded(anomaly.getThresholdExceeded());
        entity.setConfidence(anomaly.getConfidence());
        entity.setDurationMinutes(anomaly.getDurationMinutes());
        entity.setProbableCauses(json.write(anomaly.getProbableCauses()));
        entity.setMetadata(json.write(anomaly.getMetadata()));
    }

    public Anomaly toAnomaly(AnomalyEntity entity) {
        List<String> causes = json.read(entity.getProbableCauses(), STRING_LIST);
        return Anomaly.builder()
                .trendId(entity.getTrendId())
                .anomalyType(entity.getAnomalyType())
                .severity(entity.getSeverity())
                .anomalyScore(orZero(entity.getAnomalyScore()))
                .baselineValue(orZero(entity.getBaselineValue()))
                .anomalyValue(orZero(entity.getAnomalyValue()))
                .thresholdExceeded(orZero(entity.getThresholdExceeded()))
                .confidence(orZero(entity.getConfidence()))
                .probableCauses(causes != null ? causes : List.of())
                .detectionTimestamp(entity.getDetectionTimestamp())
                .durationMinutes(entity.getDurationMinutes() != null ? entity.getDurationMinutes() : 0)
                .metadata(json.read(entity.getMetadata(), AnomalyMetadata.class))
                .build();
    }

    // --- Forecasts ---

    public void copy(EnsembleForecast forecast, ForecastPrediction prediction, ForecastEntity entity) {
        entity.setTrendId(forecast.getTrendId());
        entity.setForecastOrigin(forecast.getForecastOrigin());
        entity.setHoursAhead(prediction.hoursAhead());
        entity.setPredictionTimestamp(prediction.timestamp());
        entity.setPredictedValue(prediction.predictedValue());
        entity.setConfidenceLower(prediction.confidenceLower());
        entity.setConfidenceUpper(prediction.confidenceUpper());
        entity.setConfidenceLevel(prediction.confidenceLevel());
        entity.setModelType(forecast.getModelType().getCode());
        entity.setModelAccuracy(forecast.getModelAccuracy());
        entity.setComponentModels(json.write(forecast.getComponentModels()));
        entity.setModelWeights(json.write(forecast.getModelWeights()));
        entity.setWarningFlags(json.write(forecast.getWarningFlags()));
    }

    /**
     * Rebuild an ensemble forecast from its rows, ordered by hours ahead.
     */
    public EnsembleForecast toEnsembleForecast(List<ForecastEntity> rows) {
        ForecastEntity head = rows.get(0);
        List<ForecastPrediction> predictions = rows.stream()
                .map(row -> new ForecastPrediction(
                        row.getPredictionTimestamp(),
                        row.getPredictedValue(),
                        row.getConfidenceLower(),
                        row.getConfidenceUpper(),
                        row.getConfidenceLevel(),
                        row.getHoursAhead()))
                .toList();

        List<ForecastModelType> models = json.read(head.getComponentModels(), MODEL_LIST);
        Map<ForecastModelType, Double> weights = json.read(head.getModelWeights(), WEIGHT_MAP);
        List<String> warnings = json.read(head.getWarningFlags(), STRING_LIST);

        return EnsembleForecast.builder()
                .trendId(head.getTrendId())
                .forecastOrigin(head.getForecastOrigin())
                .modelAccuracy(orZero(head.getModelAccuracy()))
                .predictions(predictions)
                .componentModels(models != null ? models : List.of())
                .modelWeights(weights != null && !weights.isEmpty() ? new EnumMap<>(weights) : Map.of())
                .warningFlags(warnings != null ? warnings : List.of())
                .build();
    }

    // --- Variants ---

    public void copy(Variant variant, VariantEntity entity) {
        entity.setTrendId(variant.getTrendId());
        entity.setVariantType(variant.getVariantType());
        entity.setVariantName(variant.getVariantName());
        entity.setTimeRangeStart(variant.getTimeRangeStart());
        entity.setTimeRangeEnd(variant.getTimeRangeEnd());
        entity.setPayload(json.write(variant.getPayload()));
        entity.setMetadata(json.write(variant.getMetadata()));
    }

    public Variant toVariant(VariantEntity entity) {
        return Variant.builder()
                .trendId(entity.getTrendId())
                .variantType(entity.getVariantType())
                .variantName(entity.getVariantName())
                .timeRangeStart(entity.getTimeRangeStart())
                .timeRangeEnd(entity.getTimeRangeEnd())
                .payload(json.read(entity.getPayload(), VariantPayload.class))
                .metadata(json.read(entity.getMetadata(), VariantMetadata.class))
                .build();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
