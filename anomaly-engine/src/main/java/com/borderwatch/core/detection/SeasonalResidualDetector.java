package com.borderwatch.core.detection;

import com.borderwatch.core.decomposition.Decomposition;
import com.borderwatch.core.decomposition.SeasonalDecomposer;
import com.borderwatch.core.decomposition.StlParameters;
import com.borderwatch.core.model.Dataset;
import com.borderwatch.core.model.DetectionConfig;
import com.borderwatch.core.model.DetectionPolicy;
import com.borderwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Seasonal-residual detector.
 *
 * <p>
 * Orders the rows chronologically, decomposes the resulting series into
 * trend, seasonal and residual components with a robust seasonal-trend
 * decomposition, and flags timestamps whose residual z-score magnitude is
 * strictly greater than the threshold.
 * </p>
 *
 * <p>
 * The decomposition is always robust. With the default
 * {@link com.borderwatch.core.decomposition.StlDecomposer}
 * a window whose points all receive zero robustness weight is refit without
 * weights, so a single spike in a short series stays in the residual. Other
 * {@link SeasonalDecomposer} implementations may behave differently there.
 * </p>
 *
 * <h3>Row identity</h3>
 * <p>
 * Rows are grouped by parsed date. The decomposition sees one value per
 * distinct date (the mean of the rows sharing it), and a flagged date flags
 * every row in its group with the same reason. Rows with a missing value or
 * a timestamp that is not a canonical {@code YYYY-MM-DD} date never enter a
 * group and are never flagged.
 * </p>
 *
 * <h3>Fail-open conditions</h3>
 * <ul>
 * <li>no row carries a timestamp</li>
 * <li>fewer than {@code 2 * seasonalPeriod} usable rows</li>
 * <li>the decomposition rejects the series or fails numerically</li>
 * <li>fewer than two residuals, or zero residual spread</li>
 * </ul>
 * <p>
 * Each yields no flags and a warning; none throws.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalResidualDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalResidualDetector.class);

    static final DateTimeFormatter CANONICAL_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final SeasonalDecomposer decomposer;

    /**
     * @param decomposer the decomposition routine; must not be {@code null}
     */
    public SeasonalResidualDetector(SeasonalDecomposer decomposer) {
        this.decomposer = Objects.requireNonNull(decomposer, "SeasonalDecomposer must not be null");
    }

    @Override
    public Detection detect(Dataset dataset, DetectionConfig config) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        Detection detection = new Detection();
        int period = config.getSeasonalPeriod();

        if (!dataset.hasTimestamps()) {
            detection.warn("Time series detection requires timestamps, but no row carries one");
            return detection;
        }

        TreeMap<LocalDate, List<Observation>> byDate = groupByDate(dataset);
        int usable = byDate.values().stream().mapToInt(List::size).sum();
        int required = 2 * period;
        if (usable < required) {
            detection.warn("Time series detection needs at least " + required
                    + " dated observations for period " + period + ", got " + usable);
            return detection;
        }

        double[] series = new double[byDate.size()];
        List<List<Observation>> groups = new ArrayList<>(byDate.size());
        int index = 0;
        for (List<Observation> group : byDate.values()) {
            series[index++] = group.stream()
                    .mapToDouble(o -> o.getValue().getAsDouble())
                    .average()
                    .orElseThrow();
            groups.add(group);
        }

        Optional<double[]> residuals = residuals(series, period, detection);
        if (residuals.isEmpty()) {
            return detection;
        }
        double[] residual = residuals.get();

        SampleStatistics stats = SampleStatistics.of(residual);
        if (!stats.hasEnoughData() || stats.isDegenerate()) {
            detection.warn("Time series detection skipped: residual standard deviation is "
                    + stats.getStdDev() + " over " + stats.getCount() + " residuals");
            return detection;
        }

        double threshold = config.getThreshold();
        for (int i = 0; i < residual.length; i++) {
            if (!Double.isFinite(residual[i])) {
                continue;
            }
            double z = stats.zScore(residual[i]);
            if (Math.abs(z) > threshold) {
                String reason = String.format("Time Series STL: Residual Z-score %s exceeds threshold %s",
                        ReasonFormat.twoDecimals(z), ReasonFormat.number(threshold));
                for (Observation observation : groups.get(i)) {
                    LOG.debug("Row {} flagged: residual={} z={}", observation.getId(), residual[i], z);
                    detection.flag(observation.getId(), reason);
                }
            }
        }
        return detection;
    }

    @Override
    public DetectionPolicy getPolicy() {
        return DetectionPolicy.TIME_SERIES_STL;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Groups valued rows by parsed date, oldest first. Rows keep their
     * caller order within a group.
     */
    private static TreeMap<LocalDate, List<Observation>> groupByDate(Dataset dataset) {
        TreeMap<LocalDate, List<Observation>> byDate = new TreeMap<>();
        int unparsed = 0;
        for (Observation observation : dataset.getObservations()) {
            if (!observation.hasValue()) {
                continue;
            }
            Optional<LocalDate> date = observation.getTimestamp().flatMap(SeasonalResidualDetector::parseDate);
            if (date.isEmpty()) {
                LOG.trace("Row {}: timestamp {} is not a canonical date - excluded",
                        observation.getId(), observation.getTimestamp().orElse(null));
                unparsed++;
                continue;
            }
            byDate.computeIfAbsent(date.get(), d -> new ArrayList<>()).add(observation);
        }
        if (unparsed > 0) {
            LOG.debug("{} row(s) excluded from time series detection: missing or unparseable timestamp", unparsed);
        }
        return byDate;
    }

    static Optional<LocalDate> parseDate(String raw) {
        try {
            return Optional.of(LocalDate.parse(raw, CANONICAL_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Runs the decomposition, converting every failure into a warning.
     */
    private Optional<double[]> residuals(double[] series, int period, Detection detection) {
        try {
            StlParameters parameters = StlParameters.forPeriod(period, true);
            Decomposition decomposition = decomposer.decompose(series, parameters);
            double[] residual = decomposition.getResidual();
            if (residual.length != series.length) {
                detection.warn("Decomposition returned " + residual.length
                        + " residuals for " + series.length + " points");
                return Optional.empty();
            }
            return Optional.of(residual);
        } catch (RuntimeException e) {
            LOG.debug("Decomposition of {} points failed", series.length, e);
            detection.warn("Seasonal decomposition failed: " + e.getMessage());
            return Optional.empty();
        }
    }
}
