/**
 * Seasonal-trend decomposition used by the time series detector.
 *
 * <p>
 * {@link com.borderwatch.core.decomposition.SeasonalDecomposer} is the seam;
 * {@link com.borderwatch.core.decomposition.StlDecomposer} is the built-in
 * LOESS implementation.
 * </p>
 *
 * <p>
 * The built-in implementation differs from classic robust STL in one case:
 * when every robustness weight in a local smoothing window is zero, that
 * local fit is recomputed without robustness weights. On series of two or
 * three cycles this keeps an isolated spike in the residual instead of
 * copying it into the seasonal component. Replacing the decomposer with a
 * classic implementation changes which rows such series flag.
 * </p>
 *
 * @since 1.0.0
 */
package com.borderwatch.core.decomposition;
