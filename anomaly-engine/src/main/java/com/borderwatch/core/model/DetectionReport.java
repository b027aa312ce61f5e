package com.borderwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one detection call: one {@link AnomalyResult} per input row, in
 * input order, plus the diagnostics raised while detecting.
 *
 * <p>
 * Warnings describe why a policy produced fewer flags than it otherwise
 * might (unknown policy, too little data, zero variance, decomposition
 * failure, ...). They never indicate a structurally invalid result.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"policy", "results", "warnings"})
public final class DetectionReport {

    private final String policy;
    private final List<AnomalyResult> results;
    private final List<String> warnings;

    public DetectionReport(String policy, List<AnomalyResult> results, List<String> warnings) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
        this.warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    /**
     * @return the policy name exactly as requested
     */
    @JsonProperty("policy")
    public String getPolicy() {
        return policy;
    }

    /**
     * @return unmodifiable list with one entry per input row, in input order
     */
    @JsonProperty("results")
    public List<AnomalyResult> getResults() {
        return results;
    }

    /**
     * @return unmodifiable list of diagnostics, empty when detection ran cleanly
     */
    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * @return the flagged results only, in input order
     */
    @JsonIgnore
    public List<AnomalyResult> getAnomalies() {
        return results.stream().filter(AnomalyResult::isAnomaly).toList();
    }

    @JsonIgnore
    public int getAnomalyCount() {
        return (int) results.stream().filter(AnomalyResult::isAnomaly).count();
    }

    @Override
    public String toString() {
        return "DetectionReport{" +
                "policy='" + policy + '\'' +
                ", rows=" + results.size() +
                ", anomalies=" + getAnomalyCount() +
                ", warnings=" + warnings +
                '}';
    }
}
