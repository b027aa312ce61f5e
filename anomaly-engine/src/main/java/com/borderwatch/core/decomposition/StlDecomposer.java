package com.borderwatch.core.decomposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Seasonal-trend decomposition by LOESS (Cleveland, Cleveland, McRae and
 * Terpenning, 1990).
 *
 * <h3>Procedure</h3>
 * <p>
 * Each inner pass detrends the series, smooths every cycle-subseries with
 * LOESS (extrapolating one cycle beyond both ends), removes the low-frequency
 * part of that seasonal estimate with moving averages of length
 * {@code period}, {@code period} and 3 followed by a LOESS pass, and finally
 * smooths the deseasonalised series into the trend. Robust fits repeat the
 * inner passes with bisquare weights derived from six times the median
 * absolute residual, so isolated outliers stop pulling the trend and seasonal
 * estimates towards themselves.
 * </p>
 *
 * <h3>Fully down-weighted windows</h3>
 * <p>
 * With only two or three cycles of data a single outlier can give every
 * point of a cycle-subseries zero robustness weight. Rather than copying the
 * raw observation into the fit, the local regression is then recomputed
 * without robustness weights.
 * </p>
 *
 * <p>
 * All smoothers are local-linear and evaluated at every point. Instances are
 * stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class StlDecomposer implements SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(StlDecomposer.class);

    @Override
    public Decomposition decompose(double[] series, StlParameters parameters) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");

        int n = series.length;
        int period = parameters.getPeriod();
        if (n < 2 * period) {
            throw new IllegalArgumentException(
                    "Series of length " + n + " is shorter than two periods (period=" + period + ")");
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(series[i])) {
                throw new IllegalArgumentException("Series value at index " + i + " is not finite: " + series[i]);
            }
        }

        double[] y = series.clone();
        double[] trend = new double[n];
        double[] seasonal = new double[n];
        double[] weights = new double[n];
        Arrays.fill(weights, 1.0);

        boolean useWeights = false;
        int outer = 0;
        while (true) {
            innerLoop(y, parameters, useWeights, weights, seasonal, trend);
            outer++;
            if (outer > parameters.getOuterIterations()) {
                break;
            }
            double[] fit = new double[n];
            for (int i = 0; i < n; i++) {
                fit[i] = trend[i] + seasonal[i];
            }
            robustnessWeights(y, fit, weights);
            useWeights = true;
        }
        if (parameters.getOuterIterations() <= 0) {
            Arrays.fill(weights, 1.0);
        }

        LOG.debug("Decomposed {} points with {}", n, parameters);
        return new Decomposition(y, trend, seasonal, weights);
    }

    // ---------------------------------------------------------------
    // Inner loop
    // ---------------------------------------------------------------

    private static void innerLoop(double[] y, StlParameters p, boolean useWeights, double[] weights,
                                  double[] seasonal, double[] trend) {
        int n = y.length;
        int np = p.getPeriod();
        double[] detrended = new double[n];
        double[] cycle = new double[n + 2 * np];
        double[] lowPass = new double[n];

        for (int iteration = 0; iteration < p.getInnerIterations(); iteration++) {
            for (int i = 0; i < n; i++) {
                detrended[i] = y[i] - trend[i];
            }
            smoothCycleSubseries(detrended, np, p.getSeasonal(), useWeights, weights, cycle);

            double[] filtered = lowPassFilter(cycle, np);
            smooth(filtered, n, p.getLowPass(), false, weights, lowPass, 0);

            for (int i = 0; i < n; i++) {
                seasonal[i] = cycle[np + i] - lowPass[i];
            }

            double[] deseasonalised = new double[n];
            for (int i = 0; i < n; i++) {
                deseasonalised[i] = y[i] - seasonal[i];
            }
            smooth(deseasonalised, n, p.getTrend(), useWeights, weights, trend, 0);
        }
    }

    /**
     * Smooths each cycle-subseries and writes the result, extended by one
     * cycle at each end, into {@code cycle} (length {@code n + 2 * np}).
     */
    private static void smoothCycleSubseries(double[] y, int np, int window, boolean useWeights,
                                             double[] weights, double[] cycle) {
        int n = y.length;
        for (int j = 0; j < np; j++) {
            int k = (n - j - 1) / np + 1;
            double[] sub = new double[k];
            double[] subWeights = new double[k];
            for (int i = 0; i < k; i++) {
                sub[i] = y[i * np + j];
                subWeights[i] = weights[i * np + j];
            }

            double[] smoothed = new double[k + 2];
            smooth(sub, k, window, useWeights, subWeights, smoothed, 1);

            double[] scratch = new double[k];
            double left = estimate(sub, k, window, 0, 1, Math.min(window, k), scratch, useWeights, subWeights);
            smoothed[0] = Double.isNaN(left) ? smoothed[1] : left;
            double right = estimate(sub, k, window, k + 1, Math.max(1, k - window + 1), k, scratch,
                    useWeights, subWeights);
            smoothed[k + 1] = Double.isNaN(right) ? smoothed[k] : right;

            for (int m = 0; m < k + 2; m++) {
                cycle[m * np + j] = smoothed[m];
            }
        }
    }

    /** Moving averages of length np, np and 3; output is {@code np * 2} shorter. */
    private static double[] lowPassFilter(double[] x, int np) {
        double[] first = movingAverage(x, np);
        double[] second = movingAverage(first, np);
        return movingAverage(second, 3);
    }

    private static double[] movingAverage(double[] x, int length) {
        int outLength = x.length - length + 1;
        double[] out = new double[outLength];
        double sum = 0;
        for (int i = 0; i < length; i++) {
            sum += x[i];
        }
        out[0] = sum / length;
        for (int i = 1; i < outLength; i++) {
            sum = sum - x[i - 1] + x[i + length - 1];
            out[i] = sum / length;
        }
        return out;
    }

    // ---------------------------------------------------------------
    // LOESS
    // ---------------------------------------------------------------

    /**
     * LOESS-smooths the first {@code n} values of {@code y} into
     * {@code out[offset .. offset + n)} using a window of {@code window}
     * points.
     */
    private static void smooth(double[] y, int n, int window, boolean useWeights, double[] weights,
                               double[] out, int offset) {
        if (n < 2) {
            out[offset] = y[0];
            return;
        }
        double[] scratch = new double[n];
        if (window >= n) {
            for (int i = 1; i <= n; i++) {
                double fitted = estimate(y, n, window, i, 1, n, scratch, useWeights, weights);
                out[offset + i - 1] = Double.isNaN(fitted) ? y[i - 1] : fitted;
            }
            return;
        }
        int half = (window + 1) / 2;
        int left = 1;
        int right = window;
        for (int i = 1; i <= n; i++) {
            if (i > half && right != n) {
                left++;
                right++;
            }
            double fitted = estimate(y, n, window, i, left, right, scratch, useWeights, weights);
            out[offset + i - 1] = Double.isNaN(fitted) ? y[i - 1] : fitted;
        }
    }

    /**
     * Local-linear fit at position {@code xs} over the 1-based positions
     * {@code left..right} with tricube neighbourhood weights.
     *
     * @return the fitted value, or {@code NaN} if every neighbourhood weight
     *         is zero even without robustness weights
     */
    private static double estimate(double[] y, int n, int window, double xs, int left, int right,
                                   double[] w, boolean useWeights, double[] robustness) {
        double range = n - 1.0;
        double h = Math.max(xs - left, right - xs);
        if (window > n) {
            h += (window - n) / 2;
        }
        double h9 = 0.999 * h;
        double h1 = 0.001 * h;

        double total = 0;
        for (int j = left; j <= right; j++) {
            w[j - 1] = 0;
            double r = Math.abs(j - xs);
            if (r <= h9) {
                if (r <= h1) {
                    w[j - 1] = 1;
                } else {
                    double q = r / h;
                    q = 1 - q * q * q;
                    w[j - 1] = q * q * q;
                }
                if (useWeights) {
                    w[j - 1] *= robustness[j - 1];
                }
                total += w[j - 1];
            }
        }
        if (total <= 0) {
            return useWeights
                    ? estimate(y, n, window, xs, left, right, w, false, robustness)
                    : Double.NaN;
        }

        for (int j = left; j <= right; j++) {
            w[j - 1] /= total;
        }
        if (h > 0) {
            double center = 0;
            for (int j = left; j <= right; j++) {
                center += w[j - 1] * j;
            }
            double slope = xs - center;
            double spread = 0;
            for (int j = left; j <= right; j++) {
                spread += w[j - 1] * (j - center) * (j - center);
            }
            if (Math.sqrt(spread) > 0.001 * range) {
                slope /= spread;
                for (int j = left; j <= right; j++) {
                    w[j - 1] *= slope * (j - center) + 1.0;
                }
            }
        }

        double fitted = 0;
        for (int j = left; j <= right; j++) {
            fitted += w[j - 1] * y[j - 1];
        }
        return fitted;
    }

    // ---------------------------------------------------------------
    // Robustness
    // ---------------------------------------------------------------

    /** Bisquare weights on |y - fit| scaled by six times the median. */
    private static void robustnessWeights(double[] y, double[] fit, double[] weights) {
        int n = y.length;
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = Math.abs(y[i] - fit[i]);
        }
        double[] sorted = residuals.clone();
        Arrays.sort(sorted);
        int upper = n / 2;
        int lower = n - upper - 1;
        double cmad = 3.0 * (sorted[upper] + sorted[lower]);
        double c9 = 0.999 * cmad;
        double c1 = 0.001 * cmad;

        for (int i = 0; i < n; i++) {
            double r = residuals[i];
            if (r <= c1) {
                weights[i] = 1.0;
            } else if (r <= c9) {
                double q = r / cmad;
                q = 1 - q * q;
                weights[i] = q * q;
            } else {
                weights[i] = 0.0;
            }
        }
    }
}
