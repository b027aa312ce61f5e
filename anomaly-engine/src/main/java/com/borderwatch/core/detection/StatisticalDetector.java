package com.borderwatch.core.detection;

import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;
import com.borderwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Global z-score outlier detector.
 *
 * <p>
 * Computes the mean and sample standard deviation of every non-missing value
 * in the dataset and flags values whose z-score magnitude is strictly greater
 * than the configured threshold. A value exactly at the threshold is not an
 * anomaly.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * Fewer than {@value SampleStatistics#MIN_SAMPLE_SIZE} values, or a zero or
 * undefined standard deviation, yields no flags and a warning.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);

    @Override
    public Detection detect(Dataset dataset, DetectionConfig config) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        Detection detection = new Detection();
        SampleStatistics stats = SampleStatistics.of(dataset.presentValues());

        if (!stats.hasEnoughData()) {
            detection.warn("Statistical detection needs at least " + SampleStatistics.MIN_SAMPLE_SIZE
                    + " non-missing values, got " + stats.getCount());
            return detection;
        }
        if (stats.isDegenerate()) {
            detection.warn("Statistical detection skipped: standard deviation is "
                    + stats.getStdDev() + " over " + stats.getCount() + " values");
            return detection;
        }

        double threshold = config.getThreshold();
        for (Observation observation : dataset.getObservations()) {
            if (!observation.hasValue()) {
                LOG.trace("Row {}: value missing - skipping", observation.getId());
                continue;
            }
            double z = stats.zScore(observation.getValue().getAsDouble());
            if (Math.abs(z) > threshold) {
                LOG.debug("Row {} flagged: z={} mean={} stddev={}",
                        observation.getId(), z, stats.getMean(), stats.getStdDev());
                detection.flag(observation.getId(), String.format(
                        "Statistical: Z-score %s exceeds threshold %s",
                        ReasonFormat.twoDecimals(z), ReasonFormat.number(threshold)));
            }
        }
        return detection;
    }

    @Override
    public DetectionPolicy getPolicy() {
        return DetectionPolicy.STATISTICAL;
    }
}
