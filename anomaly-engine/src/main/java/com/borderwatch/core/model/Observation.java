package com.borderwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A single row handed to the detection engine.
 *
 * <p>
 * Every observation carries a stable identity assigned upstream (the row's
 * primary key), an optional numeric value and an optional timestamp string in
 * canonical {@code YYYY-MM-DD} form. The engine never reassigns identities;
 * all sorting and grouping it performs internally resolves back to
 * {@link #getId()}.
 * </p>
 *
 * <h3>Missing values</h3>
 * <p>
 * A value is missing when it was never supplied or could not be read as a
 * finite number ({@code NaN}, infinities and non-numeric strings all count as
 * missing). Missing values are excluded from every statistic and are never
 * flagged.
 * </p>
 *
 * <p>
 * Instances are immutable and therefore safe to share between concurrent
 * detection calls.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Observation {

    private final long id;

    /** {@code null} when the value is missing. */
    private final Double value;

    private final String timestamp;

    private Observation(long id, Double value, String timestamp) {
        this.id = id;
        this.value = value;
        this.timestamp = timestamp;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Create an observation with a value and a timestamp.
     *
     * @param id        stable row identity
     * @param value     the observed value; {@code null} or non-finite means missing
     * @param timestamp canonical date string, may be {@code null}
     * @return a new observation
     */
    public static Observation of(long id, Double value, String timestamp) {
        return new Observation(id, finiteOrNull(value), timestamp);
    }

    /**
     * Create an observation without a timestamp.
     *
     * @param id    stable row identity
     * @param value the observed value; {@code null} or non-finite means missing
     * @return a new observation
     */
    public static Observation of(long id, Double value) {
        return of(id, value, null);
    }

    /**
     * Jackson entry point. Coerces the raw JSON value the way the ingestion
     * layer does: numbers are taken as-is, numeric strings are parsed and
     * anything else becomes a missing value.
     *
     * @param id        row identity; must not be {@code null}
     * @param rawValue  number, numeric string or {@code null}
     * @param timestamp canonical date string, may be {@code null}
     * @return a new observation
     * @throws NullPointerException if {@code id} is {@code null}
     */
    @JsonCreator
    public static Observation fromJson(@JsonProperty("id") Long id,
                                       @JsonProperty("value") Object rawValue,
                                       @JsonProperty("date") String timestamp) {
        Objects.requireNonNull(id, "Observation id must not be null");
        return new Observation(id, coerce(rawValue), timestamp);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    /**
     * @return the value, or empty when missing
     */
    public OptionalDouble getValue() {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * @return {@code true} if this observation has a usable value
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return the raw timestamp string, or empty if none was supplied
     */
    public Optional<String> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    // ---------------------------------------------------------------
    // Coercion
    // ---------------------------------------------------------------

    private static Double coerce(Object raw) {
        if (raw instanceof Number n) {
            return finiteOrNull(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return finiteOrNull(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return id == that.id
                && Objects.equals(value, that.value)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value, timestamp);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "id=" + id +
                ", value=" + value +
                ", timestamp='" + timestamp + '\'' +
                '}';
    }
}
