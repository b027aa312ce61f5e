package com.borderwatch.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable parameters for a single detection call.
 *
 * <p>
 * The policy is kept as the name the caller supplied so that the engine can
 * report an unknown policy as a warning instead of failing; resolve it with
 * {@link DetectionPolicy#fromName(String)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Builder#build()} rejects configuration that
 * could never be computed on (non-positive seasonal period, non-finite or
 * negative threshold, non-finite bounds) before any detection begins.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig {

    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_SEASONAL_PERIOD = 12;

    private final String policy;
    private final double threshold;
    private final Double minValue;
    private final Double maxValue;
    private final int seasonalPeriod;

    private DetectionConfig(Builder b) {
        this.policy = b.policy;
        this.threshold = b.threshold;
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.seasonalPeriod = b.seasonalPeriod;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shortcut for a configuration that only sets the policy.
     *
     * @param policy policy name
     * @return configuration with default threshold and period
     */
    public static DetectionConfig forPolicy(String policy) {
        return builder().policy(policy).build();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .policy(policy)
                .threshold(threshold)
                .minValue(minValue)
                .maxValue(maxValue)
                .seasonalPeriod(seasonalPeriod);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPolicy() {
        return policy;
    }

    public double getThreshold() {
        return threshold;
    }

    public OptionalDouble getMinValue() {
        return minValue != null ? OptionalDouble.of(minValue) : OptionalDouble.empty();
    }

    public OptionalDouble getMaxValue() {
        return maxValue != null ? OptionalDouble.of(maxValue) : OptionalDouble.empty();
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     */
    public static final class Builder {
        private String policy;
        private double threshold = DEFAULT_THRESHOLD;
        private Double minValue;
        private Double maxValue;
        private int seasonalPeriod = DEFAULT_SEASONAL_PERIOD;

        private Builder() {
        }

        public Builder policy(String policy) {
            this.policy = policy;
            return this;
        }

        public Builder policy(DetectionPolicy policy) {
            this.policy = policy != null ? policy.getWireName() : null;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder minValue(Double minValue) {
            this.minValue = minValue;
            return this;
        }

        public Builder maxValue(Double maxValue) {
            this.maxValue = maxValue;
            return this;
        }

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        /**
         * Build and validate.
         *
         * @return a new {@link DetectionConfig}
         * @throws NullPointerException     if no policy was set
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public DetectionConfig build() {
            Objects.requireNonNull(policy, "policy must not be null");

            List<String> errors = new ArrayList<>();
            if (!Double.isFinite(threshold) || threshold < 0) {
                errors.add("threshold must be a finite value >= 0, got: " + threshold);
            }
            if (seasonalPeriod <= 0) {
                errors.add("seasonalPeriod must be > 0, got: " + seasonalPeriod);
            }
            if (minValue != null && !Double.isFinite(minValue)) {
                errors.add("minValue must be finite, got: " + minValue);
            }
            if (maxValue != null && !Double.isFinite(maxValue)) {
                errors.add("maxValue must be finite, got: " + maxValue);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid DetectionConfig: " + String.join("; ", errors));
            }
            return new DetectionConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionConfig that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && seasonalPeriod == that.seasonalPeriod
                && policy.equals(that.policy)
                && Objects.equals(minValue, that.minValue)
                && Objects.equals(maxValue, that.maxValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policy, threshold, minValue, maxValue, seasonalPeriod);
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "policy='" + policy + '\'' +
                ", threshold=" + threshold +
                ", minValue=" + minValue +
                ", maxValue=" + maxValue +
                ", seasonalPeriod=" + seasonalPeriod +
                '}';
    }
}
