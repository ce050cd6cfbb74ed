package com.wavescope.analytics.forecast;

import com.wavescope.analytics.TestSeries;
import com.wavescope.analytics.model.TrendSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ForecastEnsemble Tests")
class ForecastEnsembleTest {

    private static final TrendSeries LINEAR = TestSeries.hourly("youtube_a", 50, 52, 54, 56, 58, 60, 62, 64, 66, 68);

    private static List<ForecastModel> allModels() {
        return new ArrayList<>(List.of(
                new PatternModel(), new SeasonalModel(), new ExponentialSmoothingModel(), new LinearRegressionModel()));
    }

    private final ForecastEnsemble ensemble = new ForecastEnsemble(allModels());

    @Test
    @DisplayName("Weights are normalized and models combined in fixed order")
    void weightsNormalized() {
        EnsembleForecast forecast = ensemble.forecast(LINEAR, 24).orElseThrow();

        double total = forecast.getModelWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(total).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.getComponentModels()).containsExactly(
                ForecastModelType.LINEAR_REGRESSION,
                ForecastModelType.EXPONENTIAL_SMOOTHING,
                ForecastModelType.SEASONAL,
                ForecastModelType.PATTERN);
        assertThat(forecast.getModelWeights().get(ForecastModelType.LINEAR_REGRESSION))
                .isGreaterThan(forecast.getModelWeights().get(ForecastModelType.SEASONAL));
        assertThat(forecast.getModelType()).isEqualTo(ForecastModelType.ENSEMBLE);
    }

    @Test
    @DisplayName("One prediction per horizon hour, anchored at the last point")
    void predictionPerHour() {
        EnsembleForecast forecast = ensemble.forecast(LINEAR, 12).orElseThrow();

        assertThat(forecast.getTrendId()).isEqualTo("youtube_a");
        assertThat(forecast.getForecastOrigin()).isEqualTo(LINEAR.last().getTimestamp());
        assertThat(forecast.getPredictions()).hasSize(12);
        for (int h = 1; h <= 12; h++) {
            ForecastPrediction p = forecast.getPredictions().get(h - 1);
            assertThat(p.hoursAhead()).isEqualTo(h);
            assertThat(p.timestamp()).isEqualTo(LINEAR.last().getTimestamp().plusHours(h));
            assertThat(p.predictedValue()).isBetween(0.0, 100.0);
            assertThat(p.confidenceLower()).isLessThanOrEqualTo(p.predictedValue());
            assertThat(p.confidenceUpper()).isGreaterThanOrEqualTo(p.predictedValue());
            assertThat(p.confidenceLevel()).isBetween(0.0, 1.0);
        }
        assertThat(forecast.getModelAccuracy()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Fewer than ten points gives no forecast")
    void insufficientHistory() {
        assertThat(ensemble.forecast(TestSeries.hourly("youtube_a", 10, 20, 30), 24)).isEmpty();
        assertThat(ensemble.forecast(null, 24)).isEmpty();
    }

    @Test
    @DisplayName("Non-positive horizon is rejected")
    void nonPositiveHorizon() {
        assertThatThrownBy(() -> ensemble.forecast(LINEAR, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A failing model is left out of the ensemble")
    void failingModelLeftOut() {
        List<ForecastModel> models = allModels();
        models.add(new ForecastModel() {
            @Override
            public ForecastModelType getType() {
                return ForecastModelType.ENSEMBLE;
            }

            @Override
            public Forecast forecast(TrendSeries history, int horizonHours) {
                throw new IllegalStateException("boom");
            }
        });

        EnsembleForecast forecast = new ForecastEnsemble(models).forecast(LINEAR, 6).orElseThrow();

        assertThat(forecast.getComponentModels()).hasSize(4).doesNotContain(ForecastModelType.ENSEMBLE);
    }

    @Test
    @DisplayName("A model without accuracy counts as 0.5 in weights and ensemble accuracy")
    void zeroAccuracyFallsBackToHalf() {
        // Given: a linear stand-in reporting accuracy 0 next to the seasonal model (fixed 0.5)
        ForecastModel unfitted = new ForecastModel() {
            @Override
            public ForecastModelType getType() {
                return ForecastModelType.LINEAR_REGRESSION;
            }

            @Override
            public Forecast forecast(TrendSeries history, int horizonHours) {
                List<ForecastPrediction> predictions = new ArrayList<>();
                for (int h = 1; h <= horizonHours; h++) {
                    predictions.add(ForecastPrediction.of(history.last().getTimestamp().plusHours(h), h, 60, 5, 0.5));
                }
                return Forecast.builder()
                        .modelType(ForecastModelType.LINEAR_REGRESSION)
                        .modelAccuracy(0.0)
                        .predictions(predictions)
                        .modelMetadata(Map.of())
                        .build();
            }
        };

        // When
        EnsembleForecast forecast = new ForecastEnsemble(List.of(unfitted, new SeasonalModel()))
                .forecast(LINEAR, 3).orElseThrow();

        // Then
        assertThat(forecast.getModelWeights().get(ForecastModelType.LINEAR_REGRESSION)).isCloseTo(0.5, within(1e-9));
        assertThat(forecast.getModelWeights().get(ForecastModelType.SEASONAL)).isCloseTo(0.5, within(1e-9));
        assertThat(forecast.getModelAccuracy()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Identical input gives identical forecasts")
    void deterministic() {
        assertThat(ensemble.forecast(LINEAR, 24)).isEqualTo(ensemble.forecast(LINEAR, 24));
    }

    @Test
    @DisplayName("Warnings flag extreme and uncertain predictions")
    void warnings() {
        LocalDateTime t = LINEAR.last().getTimestamp();
        List<String> flags = ForecastEnsemble.warnings(List.of(
                new ForecastPrediction(t, 97, 90, 100, 0.9, 1),
                new ForecastPrediction(t, 3, 0, 10, 0.2, 2)));

        assertThat(flags).containsExactly(
                "extreme_high_prediction", "extreme_low_prediction", "low_confidence", "high_volatility_forecast");
    }
}
