package com.borderwatch.core.decomposition;

/**
 * Splits an ordered numeric series into trend, seasonal and residual
 * components.
 *
 * <p>
 * Implementations must be stateless or otherwise safe for concurrent use:
 * one instance is shared by every detection call.
 * </p>
 *
 * <p>
 * Residuals are taken as {@code observed - trend - seasonal}, so an
 * implementation that absorbs outliers into its seasonal component hides
 * them from the detector. See {@link StlDecomposer} for how the built-in
 * fit treats fully down-weighted windows.
 * </p>
 *
 * @since 1.0.0
 */
public interface SeasonalDecomposer {

    /**
     * Decompose {@code series}.
     *
     * @param series     ordered observations, oldest first
     * @param parameters period, smoothing windows and robustness settings
     * @return components aligned with {@code series}
     * @throws IllegalArgumentException if the series cannot be decomposed
     *                                  with these parameters
     */
    Decomposition decompose(double[] series, StlParameters parameters);
}
