/**
 * Default detection parameters loaded from YAML.
 *
 * <p>
 * {@link com.borderwatch.core.config.DetectionConfigLoader} reads a
 * {@link com.borderwatch.core.config.DetectionProperties} document and
 * validates it before converting it to a
 * {@link com.borderwatch.core.model.DetectionConfig}. Callers typically use
 * the result as the base for per-request configurations via
 * {@link com.borderwatch.core.model.DetectionConfig#toBuilder()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.borderwatch.core.config;
