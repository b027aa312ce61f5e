package com.borderwatch.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The supported detection policies.
 *
 * <p>
 * This enum is the single source of truth for which policy names exist.
 * Request-level validation should go through {@link #require(String)}; the
 * engine itself resolves names with {@link #fromName(String)} and treats an
 * unknown name as a soft failure.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionPolicy {

    STATISTICAL("statistical", "Statistical (Z-Score)"),
    OUT_OF_RANGE("out_of_range", "Out of Range (Min/Max)"),
    TIME_SERIES_STL("time_series_stl", "Time Series (STL Residual)");

    private final String wireName;
    private final String label;

    DetectionPolicy(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    /**
     * @return the name used in requests and configuration, e.g. {@code out_of_range}
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * @return display label for option lists
     */
    public String getLabel() {
        return label;
    }

    /**
     * Resolve a policy name, ignoring case and surrounding whitespace.
     *
     * @param name policy name, may be {@code null}
     * @return the policy, or empty if the name is unknown
     */
    public static Optional<DetectionPolicy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(normalised))
                .findFirst();
    }

    /**
     * Resolve a policy name or fail.
     *
     * @param name policy name
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectionPolicy require(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown detection policy: '" + name + "'. Supported: " + supportedNames()));
    }

    /**
     * @return comma-separated list of the supported wire names
     */
    public static String supportedNames() {
        return Arrays.stream(values())
                .map(DetectionPolicy::getWireName)
                .collect(Collectors.joining(", "));
    }
}
