package com.borderwatch.core.decomposition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StlDecomposer}.
 */
class StlDecomposerTest {

    private static final double[] PATTERN = {10, 11, 12, 18, 19, 20, 11, 12, 13, 19, 20, 21};

    private StlDecomposer decomposer;

    @BeforeEach
    void setUp() {
        decomposer = new StlDecomposer();
    }

    @Test
    @DisplayName("Should reconstruct the series from its components")
    void shouldReconstructSeries() {
        double[] series = trendingPattern(36);
        series[17] = 500;

        Decomposition result = decomposer.decompose(series, StlParameters.forPeriod(12, true));

        double[] trend = result.getTrend();
        double[] seasonal = result.getSeasonal();
        double[] residual = result.getResidual();
        assertThat(result.size()).isEqualTo(36);
        for (int i = 0; i < series.length; i++) {
            assertThat(trend[i] + seasonal[i] + residual[i]).isCloseTo(series[i], within(1e-9));
        }
    }

    @Test
    @DisplayName("Should leave no residual on a linear trend plus a fixed pattern")
    void shouldFitCleanSeries() {
        Decomposition result = decomposer.decompose(trendingPattern(36), StlParameters.forPeriod(12, true));

        for (double r : result.getResidual()) {
            assertThat(r).isCloseTo(0.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should down-weight an outlier and leave it in the residual")
    void shouldIsolateOutlier() {
        double[] series = trendingPattern(36);
        series[17] = 500;

        Decomposition result = decomposer.decompose(series, StlParameters.forPeriod(12, true));

        double[] residual = result.getResidual();
        assertThat(result.getWeights()[17]).isZero();
        for (int i = 0; i < residual.length; i++) {
            if (i != 17) {
                assertThat(Math.abs(residual[i])).isLessThan(Math.abs(residual[17]));
            }
        }
    }

    @Test
    @DisplayName("Should keep a spike in the residual when its whole subseries is down-weighted")
    void shouldRefitFullyDownWeightedWindow() {
        double[] series = {
                10, 11, 12, 18, 19, 20, 11, 12, 13, 19, 20, 21,
                10, 11, 12, 18, 19, 500, 11, 12, 13, 19, 20, 21,
                10, 11, 12, 18, 19, 20};

        Decomposition result = decomposer.decompose(series, StlParameters.forPeriod(12, true));

        double[] residual = result.getResidual();
        int largest = 0;
        for (int i = 1; i < residual.length; i++) {
            if (Math.abs(residual[i]) > Math.abs(residual[largest])) {
                largest = i;
            }
        }
        assertThat(largest).isEqualTo(17);
        assertThat(residual[17]).isGreaterThan(300.0);
    }

    @Test
    @DisplayName("Should report unit weights for a non-robust fit")
    void shouldUseUnitWeightsWhenNotRobust() {
        double[] series = trendingPattern(24);
        series[5] = 100;

        Decomposition result = decomposer.decompose(series, StlParameters.forPeriod(12, false));

        assertThat(result.getWeights()).containsOnly(1.0);
    }

    @Test
    @DisplayName("Should not modify the caller's array")
    void shouldNotMutateInput() {
        double[] series = trendingPattern(24);
        double[] copy = series.clone();

        decomposer.decompose(series, StlParameters.forPeriod(12, true));

        assertThat(series).containsExactly(copy);
    }

    @Test
    @DisplayName("Should reject a series shorter than two periods")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> decomposer.decompose(trendingPattern(23), StlParameters.forPeriod(12, true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shorter than two periods");
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFinite() {
        double[] series = trendingPattern(24);
        series[3] = Double.NaN;

        assertThatThrownBy(() -> decomposer.decompose(series, StlParameters.forPeriod(12, true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 3");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private double[] trendingPattern(int length) {
        double[] series = new double[length];
        for (int i = 0; i < length; i++) {
            series[i] = PATTERN[i % 12] + 0.1 * i;
        }
        return series;
    }
}
