package com.borderwatch.core.detection;

import com.borderwatch.core.decomposition.SeasonalDecomposer;
import com.borderwatch.core.decomposition.StlDecomposer;
import com.borderwatch.core.model.AnomalyResult;
import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;
import com.borderwatch.core.model.DetectionReport;
import com.borderwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the detection engine.
 *
 * <p>
 * Resolves the configured policy, runs the matching detector and returns a
 * {@link DetectionReport} with exactly one {@link AnomalyResult} per input
 * row, in input order. The input dataset is never modified.
 * </p>
 *
 * <h3>Fail-open</h3>
 * <p>
 * An unknown policy name is not an error at this layer: every row comes back
 * unflagged and the report carries a warning. Callers that must reject
 * unknown policies should validate with
 * {@link DetectionPolicy#require(String)} before calling.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The engine holds no per-call state and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    private final Map<DetectionPolicy, AnomalyDetector> detectors;

    /**
     * Engine backed by {@link StlDecomposer}.
     */
    public AnomalyEngine() {
        this(new StlDecomposer());
    }

    /**
     * @param decomposer decomposition routine for the time series policy
     */
    public AnomalyEngine(SeasonalDecomposer decomposer) {
        this.detectors = DetectorFactory.createAll(decomposer);
    }

    /**
     * Classify every row of {@code dataset}.
     *
     * @param dataset rows to classify; must not be {@code null}
     * @param config  parameters for this call; must not be {@code null}
     * @return one result per row plus diagnostics
     */
    public DetectionReport detect(Dataset dataset, DetectionConfig config) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        Detection detection = run(dataset, config);
        for (String warning : detection.getWarnings()) {
            LOG.warn("Policy [{}]: {}", config.getPolicy(), warning);
        }

        List<AnomalyResult> results = dataset.getObservations().stream()
                .map(observation -> toResult(observation, detection))
                .toList();

        DetectionReport report = new DetectionReport(config.getPolicy(), results, detection.getWarnings());
        LOG.debug("Policy [{}]: {} of {} row(s) flagged",
                config.getPolicy(), report.getAnomalyCount(), dataset.size());
        return report;
    }

    private Detection run(Dataset dataset, DetectionConfig config) {
        Optional<DetectionPolicy> policy = DetectionPolicy.fromName(config.getPolicy());
        if (policy.isEmpty()) {
            Detection detection = new Detection();
            detection.warn("Unknown detection policy '" + config.getPolicy()
                    + "'. No anomalies detected. Supported: " + DetectionPolicy.supportedNames());
            return detection;
        }
        if (dataset.isEmpty() || dataset.presentValues().length == 0) {
            return new Detection();
        }
        return detectors.get(policy.get()).detect(dataset, config);
    }

    private static AnomalyResult toResult(Observation observation, Detection detection) {
        // Missing values are never flagged, whatever the detector reported.
        if (!observation.hasValue()) {
            return AnomalyResult.normal(observation.getId());
        }
        return detection.reasonFor(observation.getId())
                .map(reason -> AnomalyResult.anomaly(observation.getId(), reason))
                .orElseGet(() -> AnomalyResult.normal(observation.getId()));
    }
}
