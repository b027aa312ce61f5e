/**
 * Pluggable anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.borderwatch.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.borderwatch.core.detection.DetectorFactory}.
 * {@link com.borderwatch.core.detection.AnomalyEngine} dispatches to them by
 * policy name. Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.borderwatch.core.detection.StatisticalDetector}: global
 * z-score</li>
 * <li>{@link com.borderwatch.core.detection.RangeDetector}: fixed
 * {@code [min, max]} band</li>
 * <li>{@link com.borderwatch.core.detection.SeasonalResidualDetector}:
 * z-score of seasonal-trend decomposition residuals</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a policy, add a {@link com.borderwatch.core.model.DetectionPolicy}
 * constant, implement {@code AnomalyDetector} and register it in
 * {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.borderwatch.core.detection;
