package com.borderwatch.core.decomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a seasonal-trend decomposition.
 *
 * <p>
 * {@link #forPeriod(int, boolean)} derives every smoothing window from the
 * period:
 * </p>
 * <ul>
 * <li>seasonal: {@code max(7, period + 1)} for even periods,
 * {@code max(7, period)} for odd ones</li>
 * <li>trend: smallest odd integer &ge;
 * {@code 1.5 * period / (1 - 1.5 / seasonal)}</li>
 * <li>low-pass: smallest odd integer &gt; {@code period}</li>
 * </ul>
 * <p>
 * Robust fitting runs {@value #ROBUST_INNER_ITERATIONS} inner passes inside
 * {@value #ROBUST_OUTER_ITERATIONS} robustness iterations; non-robust
 * fitting runs {@value #INNER_ITERATIONS} inner passes and no robustness
 * iterations.
 * </p>
 *
 * @since 1.0.0
 */
public final class StlParameters {

    static final int ROBUST_INNER_ITERATIONS = 2;
    static final int ROBUST_OUTER_ITERATIONS = 15;
    static final int INNER_ITERATIONS = 5;

    private static final int MIN_SEASONAL_WINDOW = 7;

    private final int period;
    private final int seasonal;
    private final int trend;
    private final int lowPass;
    private final boolean robust;
    private final int innerIterations;
    private final int outerIterations;

    private StlParameters(Builder b) {
        this.period = b.period;
        this.seasonal = b.seasonal;
        this.trend = b.trend;
        this.lowPass = b.lowPass;
        this.robust = b.robust;
        this.innerIterations = b.innerIterations;
        this.outerIterations = b.outerIterations;
    }

    /**
     * Default parameters for a period.
     *
     * @param period observations per cycle; must be &ge; 2
     * @param robust whether to down-weight outliers
     * @return validated parameters
     * @throws IllegalArgumentException if {@code period} is below 2
     */
    public static StlParameters forPeriod(int period, boolean robust) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        int seasonal = seasonalWindowFor(period);
        return builder()
                .period(period)
                .seasonal(seasonal)
                .trend(trendWindowFor(period, seasonal))
                .lowPass(nextOdd(period + 1))
                .robust(robust)
                .build();
    }

    /**
     * @param period observations per cycle
     * @return the seasonal smoothing window for {@code period}
     */
    public static int seasonalWindowFor(int period) {
        int window = period % 2 == 0 ? period + 1 : period;
        return Math.max(MIN_SEASONAL_WINDOW, window);
    }

    static int trendWindowFor(int period, int seasonal) {
        return nextOdd((int) Math.ceil(1.5 * period / (1.0 - 1.5 / seasonal)));
    }

    private static int nextOdd(int n) {
        return n % 2 == 0 ? n + 1 : n;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getPeriod() {
        return period;
    }

    public int getSeasonal() {
        return seasonal;
    }

    public int getTrend() {
        return trend;
    }

    public int getLowPass() {
        return lowPass;
    }

    public boolean isRobust() {
        return robust;
    }

    public int getInnerIterations() {
        return innerIterations;
    }

    public int getOuterIterations() {
        return outerIterations;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for explicit parameter sets. Iteration counts follow the
     * robust flag unless set explicitly.
     */
    public static final class Builder {
        private int period;
        private int seasonal;
        private int trend;
        private int lowPass;
        private boolean robust;
        private Integer innerIterations;
        private Integer outerIterations;

        private Builder() {
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder seasonal(int seasonal) {
            this.seasonal = seasonal;
            return this;
        }

        public Builder trend(int trend) {
            this.trend = trend;
            return this;
        }

        public Builder lowPass(int lowPass) {
            this.lowPass = lowPass;
            return this;
        }

        public Builder robust(boolean robust) {
            this.robust = robust;
            return this;
        }

        public Builder innerIterations(int innerIterations) {
            this.innerIterations = innerIterations;
            return this;
        }

        public Builder outerIterations(int outerIterations) {
            this.outerIterations = outerIterations;
            return this;
        }

        /**
         * @return validated parameters
         * @throws IllegalArgumentException if any window or count is invalid
         */
        public StlParameters build() {
            if (innerIterations == null) {
                innerIterations = robust ? ROBUST_INNER_ITERATIONS : INNER_ITERATIONS;
            }
            if (outerIterations == null) {
                outerIterations = robust ? ROBUST_OUTER_ITERATIONS : 0;
            }

            List<String> errors = new ArrayList<>();
            if (period < 2) {
                errors.add("period must be >= 2, got: " + period);
            }
            checkWindow("seasonal", seasonal, errors);
            checkWindow("trend", trend, errors);
            checkWindow("lowPass", lowPass, errors);
            if (trend <= period) {
                errors.add("trend must be > period, got: " + trend);
            }
            if (lowPass <= period) {
                errors.add("lowPass must be > period, got: " + lowPass);
            }
            if (innerIterations < 1) {
                errors.add("innerIterations must be >= 1, got: " + innerIterations);
            }
            if (outerIterations < 0) {
                errors.add("outerIterations must be >= 0, got: " + outerIterations);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid STL parameters: " + String.join("; ", errors));
            }
            return new StlParameters(this);
        }

        private static void checkWindow(String name, int value, List<String> errors) {
            if (value < 3 || value % 2 == 0) {
                errors.add(name + " must be an odd integer >= 3, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "StlParameters{" +
                "period=" + period +
                ", seasonal=" + seasonal +
                ", trend=" + trend +
                ", lowPass=" + lowPass +
                ", robust=" + robust +
                ", inner=" + innerIterations +
                ", outer=" + outerIterations +
                '}';
    }
}
