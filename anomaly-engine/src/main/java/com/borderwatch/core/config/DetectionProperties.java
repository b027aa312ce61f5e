package com.borderwatch.core.config;

import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detection defaults YAML file.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * policy: time_series_stl
 * threshold: 3.0
 * seasonalPeriod: 12
 * minValue: 0.0      # optional
 * maxValue: 250000.0 # optional
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link #toConfig()} converts the
 * validated properties into an immutable {@link DetectionConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionProperties {

    private String policy = DetectionPolicy.STATISTICAL.getWireName();
    private double threshold = DetectionConfig.DEFAULT_THRESHOLD;
    private Double minValue;
    private Double maxValue;
    private int seasonalPeriod = DetectionConfig.DEFAULT_SEASONAL_PERIOD;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every property, collecting all errors.
     *
     * <p>
     * Unlike a per-request policy, a policy written into configuration must
     * name a supported detector.
     * </p>
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (policy == null || policy.isBlank()) {
            errors.add("'policy' is required");
        } else if (DetectionPolicy.fromName(policy).isEmpty()) {
            errors.add("Unknown policy: '" + policy + "'. Supported: " + DetectionPolicy.supportedNames());
        }
        if (!Double.isFinite(threshold) || threshold < 0) {
            errors.add("'threshold' must be a finite value >= 0, got: " + threshold);
        }
        if (seasonalPeriod <= 0) {
            errors.add("'seasonalPeriod' must be > 0, got: " + seasonalPeriod);
        }
        if (minValue != null && !Double.isFinite(minValue)) {
            errors.add("'minValue' must be finite, got: " + minValue);
        }
        if (maxValue != null && !Double.isFinite(maxValue)) {
            errors.add("'maxValue' must be finite, got: " + maxValue);
        }
        if (DetectionPolicy.OUT_OF_RANGE.getWireName().equalsIgnoreCase(policy)
                && minValue == null && maxValue == null) {
            errors.add("Policy 'out_of_range' requires 'minValue' or 'maxValue'");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid detection configuration: " + String.join("; ", errors));
        }
    }

    /**
     * @return an immutable configuration with these values
     */
    public DetectionConfig toConfig() {
        return DetectionConfig.builder()
                .policy(DetectionPolicy.require(policy))
                .threshold(threshold)
                .minValue(minValue)
                .maxValue(maxValue)
                .seasonalPeriod(seasonalPeriod)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getPolicy() {
        return policy;
    }

    public void setPolicy(String policy) {
        this.policy = policy;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Double getMinValue() {
        return minValue;
    }

    public void setMinValue(Double minValue) {
        this.minValue = minValue;
    }

    public Double getMaxValue() {
        return maxValue;
    }

    public void setMaxValue(Double maxValue) {
        this.maxValue = maxValue;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(int seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod;
    }

    @Override
    public String toString() {
        return "DetectionProperties{" +
                "policy='" + policy + '\'' +
                ", threshold=" + threshold +
                ", minValue=" + minValue +
                ", maxValue=" + maxValue +
                ", seasonalPeriod=" + seasonalPeriod +
                '}';
    }
}
