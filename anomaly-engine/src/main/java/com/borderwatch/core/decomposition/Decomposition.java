package com.borderwatch.core.decomposition;

import java.util.Objects;

/**
 * Result of a seasonal-trend decomposition. All component arrays have the
 * length and ordering of the input series, and
 * {@code observed[i] == trend[i] + seasonal[i] + residual[i]}.
 *
 * <p>
 * Accessors return copies.
 * </p>
 *
 * @since 1.0.0
 */
public final class Decomposition {

    private final double[] observed;
    private final double[] trend;
    private final double[] seasonal;
    private final double[] weights;

    /**
     * @param observed input series
     * @param trend    trend component
     * @param seasonal seasonal component
     * @param weights  final robustness weights (all 1 for non-robust fits)
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public Decomposition(double[] observed, double[] trend, double[] seasonal, double[] weights) {
        Objects.requireNonNull(observed, "observed must not be null");
        Objects.requireNonNull(trend, "trend must not be null");
        Objects.requireNonNull(seasonal, "seasonal must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        int n = observed.length;
        if (trend.length != n || seasonal.length != n || weights.length != n) {
            throw new IllegalArgumentException("Component lengths differ from series length " + n);
        }
        this.observed = observed.clone();
        this.trend = trend.clone();
        this.seasonal = seasonal.clone();
        this.weights = weights.clone();
    }

    public int size() {
        return observed.length;
    }

    public double[] getObserved() {
        return observed.clone();
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    /**
     * @return {@code observed - trend - seasonal}
     */
    public double[] getResidual() {
        double[] residual = new double[observed.length];
        for (int i = 0; i < observed.length; i++) {
            residual[i] = observed[i] - trend[i] - seasonal[i];
        }
        return residual;
    }

    public double[] getWeights() {
        return weights.clone();
    }
}
