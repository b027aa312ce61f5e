/**
 * Domain model shared between the detection engine and its callers.
 *
 * <ul>
 * <li>{@link com.borderwatch.core.model.Observation}: one input row</li>
 * <li>{@link com.borderwatch.core.model.Dataset}: ordered rows with unique
 * identities</li>
 * <li>{@link com.borderwatch.core.model.DetectionConfig}: per-call
 * parameters</li>
 * <li>{@link com.borderwatch.core.model.AnomalyResult}: per-row
 * classification</li>
 * <li>{@link com.borderwatch.core.model.DetectionReport}: all results plus
 * diagnostics</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.borderwatch.core.model;
