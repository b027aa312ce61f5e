package com.borderwatch.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable sequence of {@link Observation}s.
 *
 * <p>
 * Row order is preserved in the externally visible result but carries no
 * meaning for the statistical and range detectors. Identities must be unique;
 * a dataset with duplicate identities is a caller error.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private final List<Observation> observations;

    /**
     * @param observations rows in caller order; must not be {@code null} and
     *                     must not contain {@code null} elements
     * @throws NullPointerException     if the list or any element is {@code null}
     * @throws IllegalArgumentException if two rows share an identity
     */
    public Dataset(List<Observation> observations) {
        Objects.requireNonNull(observations, "Observations must not be null");
        Set<Long> seen = new HashSet<>();
        List<Observation> copy = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            Observation observation = Objects.requireNonNull(observations.get(i),
                    "Observation at index " + i + " is null");
            if (!seen.add(observation.getId())) {
                throw new IllegalArgumentException(
                        "Duplicate observation id " + observation.getId() + " at index " + i);
            }
            copy.add(observation);
        }
        this.observations = List.copyOf(copy);
    }

    /**
     * Convenience factory.
     *
     * @param observations rows in caller order
     * @return a new dataset
     */
    public static Dataset of(Observation... observations) {
        return new Dataset(List.of(observations));
    }

    /**
     * @return unmodifiable list of rows in caller order
     */
    public List<Observation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * @return the non-missing values, in row order
     */
    public double[] presentValues() {
        return observations.stream()
                .filter(Observation::hasValue)
                .mapToDouble(o -> o.getValue().getAsDouble())
                .toArray();
    }

    /**
     * @return {@code true} if at least one row carries a timestamp
     */
    public boolean hasTimestamps() {
        return observations.stream().anyMatch(o -> o.getTimestamp().isPresent());
    }

    @Override
    public String toString() {
        return "Dataset{size=" + observations.size() + '}';
    }
}
