package com.borderwatch.core.detection;

import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;
import com.borderwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Out-of-range detector.
 *
 * <p>
 * Flags values strictly below the configured minimum or strictly above the
 * configured maximum. Either bound may be omitted, but not both: with no
 * bounds the detector flags nothing and warns.
 * </p>
 *
 * <p>
 * When {@code minValue > maxValue} a value can violate both bounds; its
 * reason then lists the below-minimum violation first and the above-maximum
 * one second, joined by {@code "; "}.
 * </p>
 *
 * @since 1.0.0
 */
public class RangeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RangeDetector.class);

    @Override
    public Detection detect(Dataset dataset, DetectionConfig config) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        Detection detection = new Detection();
        OptionalDouble min = config.getMinValue();
        OptionalDouble max = config.getMaxValue();

        if (min.isEmpty() && max.isEmpty()) {
            detection.warn("Out of Range detection selected but no min or max provided");
            return detection;
        }

        for (Observation observation : dataset.getObservations()) {
            if (!observation.hasValue()) {
                continue;
            }
            double v = observation.getValue().getAsDouble();
            List<String> violations = new ArrayList<>(2);

            if (min.isPresent() && v < min.getAsDouble()) {
                violations.add("Out of Range: Value " + ReasonFormat.number(v)
                        + " is below minimum " + ReasonFormat.number(min.getAsDouble()));
            }
            if (max.isPresent() && v > max.getAsDouble()) {
                violations.add("Out of Range: Value " + ReasonFormat.number(v)
                        + " is above maximum " + ReasonFormat.number(max.getAsDouble()));
            }

            if (!violations.isEmpty()) {
                LOG.debug("Row {} flagged: value={} min={} max={}", observation.getId(), v, min, max);
                detection.flag(observation.getId(), String.join(Detection.REASON_SEPARATOR, violations));
            }
        }
        return detection;
    }

    @Override
    public DetectionPolicy getPolicy() {
        return DetectionPolicy.OUT_OF_RANGE;
    }
}
