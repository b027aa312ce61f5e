package com.borderwatch.core.detection;

import com.borderwatch.core.model.AnomalyResult;
import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;
import com.borderwatch.core.model.DetectionReport;
import com.borderwatch.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link AnomalyEngine}.
 */
class AnomalyEngineTest {

    private static final double[] MONTHLY_WITH_SPIKE = {
            10, 11, 12, 18, 19, 20, 11, 12, 13, 19, 20, 21,
            10, 11, 12, 18, 19, 500, 11, 12, 13, 19, 20, 21,
            10, 11, 12, 18, 19, 20};

    private AnomalyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AnomalyEngine();
    }

    // ------------------------------------------------------------------
    // Result shape
    // ------------------------------------------------------------------

    @ParameterizedTest
    @EnumSource(DetectionPolicy.class)
    @DisplayName("Should return one result per row in input order")
    void shouldPreserveCardinalityAndOrder(DetectionPolicy policy) {
        Dataset dataset = basicData();

        DetectionReport report = engine.detect(dataset, config(policy));

        assertThat(report.getResults()).extracting(AnomalyResult::getId)
                .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
        assertThat(report.getPolicy()).isEqualTo(policy.getWireName());
    }

    @ParameterizedTest
    @EnumSource(DetectionPolicy.class)
    @DisplayName("Should carry a reason if and only if the row is anomalous")
    void shouldPairReasonWithFlag(DetectionPolicy policy) {
        DetectionReport report = engine.detect(basicData(), config(policy));

        assertThat(report.getResults()).allSatisfy(result ->
                assertThat(result.getReason().isEmpty()).isEqualTo(!result.isAnomaly()));
    }

    @ParameterizedTest
    @EnumSource(DetectionPolicy.class)
    @DisplayName("Should never flag a missing value")
    void shouldNeverFlagMissingValue(DetectionPolicy policy) {
        DetectionConfig config = config(policy).toBuilder().threshold(0.0).minValue(1_000.0).build();

        DetectionReport report = engine.detect(basicData(), config);

        assertThat(report.getResults()).filteredOn(r -> r.getId() == 7L)
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.isAnomaly()).isFalse();
                    assertThat(r.getReason()).isEmpty();
                });
    }

    @Test
    @DisplayName("Should return the same report for the same input")
    void shouldBeIdempotent() {
        DetectionConfig config = config(DetectionPolicy.STATISTICAL).toBuilder().threshold(2.0).build();

        DetectionReport first = engine.detect(basicData(), config);
        DetectionReport second = engine.detect(basicData(), config);

        assertThat(second.getResults()).isEqualTo(first.getResults());
        assertThat(second.getWarnings()).isEqualTo(first.getWarnings());
    }

    @Test
    @DisplayName("Should leave the input dataset untouched")
    void shouldNotMutateInput() {
        Dataset dataset = monthly(MONTHLY_WITH_SPIKE);
        List<Observation> before = new ArrayList<>(dataset.getObservations());

        engine.detect(dataset, config(DetectionPolicy.TIME_SERIES_STL));

        assertThat(dataset.getObservations()).containsExactlyElementsOf(before);
    }

    // ------------------------------------------------------------------
    // Policies
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should dispatch to the statistical detector")
    void shouldRunStatisticalPolicy() {
        DetectionConfig config = DetectionConfig.builder().policy("statistical").threshold(2.0).build();

        DetectionReport report = engine.detect(basicData(), config);

        assertThat(report.getAnomalies()).singleElement()
                .isEqualTo(AnomalyResult.anomaly(4, "Statistical: Z-score 2.04 exceeds threshold 2.0"));
        assertThat(report.getAnomalyCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should dispatch to the range detector")
    void shouldRunRangePolicy() {
        DetectionConfig config = DetectionConfig.builder()
                .policy("out_of_range")
                .minValue(9.9)
                .maxValue(50.0)
                .build();

        DetectionReport report = engine.detect(basicData(), config);

        assertThat(report.getAnomalies()).extracting(AnomalyResult::getId).containsExactly(4L, 5L);
    }

    @Test
    @DisplayName("Should dispatch to the time series detector")
    void shouldRunTimeSeriesPolicy() {
        DetectionReport report = engine.detect(monthly(MONTHLY_WITH_SPIKE), config(DetectionPolicy.TIME_SERIES_STL));

        assertThat(report.getAnomalies()).extracting(AnomalyResult::getId).containsExactly(18L);
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve policy names case-insensitively")
    void shouldResolvePolicyIgnoringCase() {
        DetectionConfig config = DetectionConfig.builder().policy("  Statistical ").threshold(2.0).build();

        DetectionReport report = engine.detect(basicData(), config);

        assertThat(report.getAnomalyCount()).isEqualTo(1);
        assertThat(report.getPolicy()).isEqualTo("  Statistical ");
    }

    @Test
    @DisplayName("Should flag nothing and warn on an unknown policy")
    void shouldFailOpenOnUnknownPolicy() {
        DetectionReport report = engine.detect(basicData(), DetectionConfig.forPolicy("magic"));

        assertThat(report.getResults()).hasSize(7).noneMatch(AnomalyResult::isAnomaly);
        assertThat(report.getWarnings()).singleElement().asString()
                .contains("Unknown detection policy 'magic'")
                .contains(DetectionPolicy.supportedNames());
    }

    @Test
    @DisplayName("Should use the injected decomposer for the time series policy")
    void shouldUseInjectedDecomposer() {
        AnomalyEngine failing = new AnomalyEngine((series, parameters) -> {
            throw new IllegalStateException("boom");
        });

        DetectionReport report = failing.detect(monthly(MONTHLY_WITH_SPIKE), config(DetectionPolicy.TIME_SERIES_STL));

        assertThat(report.getAnomalyCount()).isZero();
        assertThat(report.getWarnings()).containsExactly("Seasonal decomposition failed: boom");
    }

    // ------------------------------------------------------------------
    // Edge cases
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should return an empty report for an empty dataset")
    void shouldHandleEmptyDataset() {
        DetectionReport report = engine.detect(new Dataset(List.of()), config(DetectionPolicy.STATISTICAL));

        assertThat(report.getResults()).isEmpty();
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should return all rows unflagged when every value is missing")
    void shouldHandleAllMissing() {
        Dataset dataset = Dataset.of(Observation.of(1, null), Observation.of(2, Double.NaN));

        DetectionReport report = engine.detect(dataset, config(DetectionPolicy.STATISTICAL));

        assertThat(report.getResults()).containsExactly(AnomalyResult.normal(1), AnomalyResult.normal(2));
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> engine.detect(null, config(DetectionPolicy.STATISTICAL)))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> engine.detect(basicData(), null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should give identical results when shared between threads")
    void shouldBeSafeToShare() throws Exception {
        DetectionConfig config = config(DetectionPolicy.TIME_SERIES_STL);
        Dataset dataset = monthly(MONTHLY_WITH_SPIKE);
        DetectionReport expected = engine.detect(dataset, config);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<DetectionReport>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> engine.detect(dataset, config)));
            }
            for (Future<DetectionReport> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).getResults()).isEqualTo(expected.getResults());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectionConfig config(DetectionPolicy policy) {
        return DetectionConfig.builder().policy(policy).build();
    }

    private Dataset basicData() {
        return Dataset.of(
                Observation.of(1, 10.0, "2023-01-01"),
                Observation.of(2, 11.0, "2023-02-01"),
                Observation.of(3, 10.5, "2023-03-01"),
                Observation.of(4, 100.0, "2023-04-01"),
                Observation.of(5, 9.8, "2023-05-01"),
                Observation.of(6, 10.2, "2023-06-01"),
                Observation.of(7, null, "2023-07-01"));
    }

    private Dataset monthly(double[] values) {
        List<Observation> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            rows.add(Observation.of(i + 1, values[i], String.format("%d-%02d-01", 2022 + i / 12, i % 12 + 1)));
        }
        return new Dataset(rows);
    }
}
