package com.borderwatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Dataset} and {@link Observation}.
 */
class DatasetTest {

    @Test
    @DisplayName("Should reject duplicate identities")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> Dataset.of(Observation.of(1, 1.0), Observation.of(1, 2.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate observation id 1 at index 1");
    }

    @Test
    @DisplayName("Should reject null rows")
    void shouldRejectNullRow() {
        List<Observation> rows = Arrays.asList(Observation.of(1, 1.0), null);

        assertThatThrownBy(() -> new Dataset(rows))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    @DisplayName("Should not be affected by later changes to the source list")
    void shouldCopySourceList() {
        List<Observation> rows = new ArrayList<>(List.of(Observation.of(1, 1.0)));
        Dataset dataset = new Dataset(rows);

        rows.add(Observation.of(2, 2.0));

        assertThat(dataset.size()).isEqualTo(1);
        assertThatThrownBy(() -> dataset.getObservations().add(Observation.of(3, 3.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should expose only present values")
    void shouldExposePresentValues() {
        Dataset dataset = Dataset.of(
                Observation.of(1, 4.0),
                Observation.of(2, null),
                Observation.of(3, Double.POSITIVE_INFINITY),
                Observation.of(4, 6.0));

        assertThat(dataset.presentValues()).containsExactly(4.0, 6.0);
        assertThat(dataset.hasTimestamps()).isFalse();
    }

    @Test
    @DisplayName("Should treat non-finite values as missing")
    void shouldTreatNonFiniteAsMissing() {
        Observation observation = Observation.of(9, Double.NaN, "2023-01-01");

        assertThat(observation.hasValue()).isFalse();
        assertThat(observation.getValue()).isEmpty();
        assertThat(observation.getTimestamp()).hasValue("2023-01-01");
    }
}
