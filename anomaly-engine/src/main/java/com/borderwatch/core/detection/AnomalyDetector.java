package com.borderwatch.core.detection;

import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;

/**
 * Contract for all anomaly detectors.
 *
 * <p>
 * Detectors are <strong>stateless</strong>: a single instance serves every
 * detection call and may be invoked concurrently. Everything a call needs
 * arrives through its arguments.
 * </p>
 *
 * <p>
 * A detector never throws for data-quality problems. Too little data,
 * degenerate distributions, unusable timestamps and numerical failures are
 * reported through {@link Detection#warn(String)} and result in fewer (or no)
 * flags.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Classify the rows of a dataset.
     *
     * @param dataset the rows to examine; never modified
     * @param config  parameters for this call
     * @return flagged identities with reasons, plus any diagnostics
     */
    Detection detect(Dataset dataset, DetectionConfig config);

    /**
     * @return the policy this detector implements
     */
    DetectionPolicy getPolicy();
}
