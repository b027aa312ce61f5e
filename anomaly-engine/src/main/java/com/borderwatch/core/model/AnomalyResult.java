package com.borderwatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Classification of one input row.
 *
 * <p>
 * The reason is non-empty if and only if the row is anomalous. Use
 * {@link #anomaly(long, String)} and {@link #normal(long)} to construct
 * instances; both enforce that pairing.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"id", "is_anomaly", "anomaly_reason"})
public final class AnomalyResult {

    private final long id;
    private final boolean anomaly;
    private final String reason;

    private AnomalyResult(long id, boolean anomaly, String reason) {
        this.id = id;
        this.anomaly = anomaly;
        this.reason = reason;
    }

    /**
     * @param id     identity of the flagged row
     * @param reason human-readable explanation; must not be blank
     * @return an anomalous result
     * @throws IllegalArgumentException if {@code reason} is blank
     */
    public static AnomalyResult anomaly(long id, String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("An anomaly must carry a reason (id=" + id + ")");
        }
        return new AnomalyResult(id, true, reason);
    }

    /**
     * @param id identity of the row
     * @return a non-anomalous result with an empty reason
     */
    public static AnomalyResult normal(long id) {
        return new AnomalyResult(id, false, "");
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("is_anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    @JsonProperty("anomaly_reason")
    public String getReason() {
        return reason;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyResult that))
            return false;
        return id == that.id && anomaly == that.anomaly && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, anomaly, reason);
    }

    @Override
    public String toString() {
        return "AnomalyResult{" +
                "id=" + id +
                ", anomaly=" + anomaly +
                ", reason='" + reason + '\'' +
                '}';
    }
}
