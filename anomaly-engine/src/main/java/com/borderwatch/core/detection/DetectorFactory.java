package com.borderwatch.core.detection;

import com.borderwatch.core.decomposition.SeasonalDecomposer;
import com.borderwatch.core.model.DetectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates the {@link AnomalyDetector} for each
 * {@link DetectionPolicy}.
 *
 * <p>
 * This is the single point of extension when adding a new policy: add the
 * enum constant and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class - not instantiable
    }

    /**
     * Create the detector for a policy.
     *
     * @param policy     the policy; must not be {@code null}
     * @param decomposer decomposition routine used by the time series policy;
     *                   must not be {@code null}
     * @return a new detector
     * @throws NullPointerException if either argument is {@code null}
     */
    public static AnomalyDetector create(DetectionPolicy policy, SeasonalDecomposer decomposer) {
        Objects.requireNonNull(policy, "DetectionPolicy must not be null");
        Objects.requireNonNull(decomposer, "SeasonalDecomposer must not be null");

        return switch (policy) {
            case STATISTICAL -> new StatisticalDetector();
            case OUT_OF_RANGE -> new RangeDetector();
            case TIME_SERIES_STL -> new SeasonalResidualDetector(decomposer);
        };
    }

    /**
     * Create one detector per supported policy.
     *
     * <p>
     * The returned map is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param decomposer decomposition routine; must not be {@code null}
     * @return unmodifiable map of policy to detector
     */
    public static Map<DetectionPolicy, AnomalyDetector> createAll(SeasonalDecomposer decomposer) {
        Map<DetectionPolicy, AnomalyDetector> detectors = new EnumMap<>(DetectionPolicy.class);
        for (DetectionPolicy policy : DetectionPolicy.values()) {
            detectors.put(policy, create(policy, decomposer));
        }
        LOG.info("Created {} detector(s): {}", detectors.size(), DetectionPolicy.supportedNames());
        return Collections.unmodifiableMap(detectors);
    }
}
