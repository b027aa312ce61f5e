package com.borderwatch.core.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable outcome of a single detector run: the identities it flagged, each
 * with a reason, and the warnings it raised.
 *
 * <p>
 * Not thread-safe; each detection call creates its own instance.
 * </p>
 */
public final class Detection {

    static final String REASON_SEPARATOR = "; ";

    private final Map<Long, String> reasons = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    /**
     * Flag a row. Flagging the same row twice appends the second reason.
     *
     * @param id     row identity
     * @param reason explanation; must not be blank
     */
    public void flag(long id, String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be blank");
        }
        reasons.merge(id, reason, (first, second) -> first + REASON_SEPARATOR + second);
    }

    /**
     * Record a diagnostic explaining why detection was skipped or limited.
     *
     * @param message human-readable warning
     */
    public void warn(String message) {
        warnings.add(Objects.requireNonNull(message, "message must not be null"));
    }

    /**
     * @param id row identity
     * @return the reason the row was flagged, or empty if it was not
     */
    public Optional<String> reasonFor(long id) {
        return Optional.ofNullable(reasons.get(id));
    }

    public boolean isFlagged(long id) {
        return reasons.containsKey(id);
    }

    /**
     * @return unmodifiable view of flagged identities to reasons, in flag order
     */
    public Map<Long, String> getFlagged() {
        return Collections.unmodifiableMap(reasons);
    }

    /**
     * @return unmodifiable view of the warnings, in the order raised
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "Detection{flagged=" + reasons.keySet() + ", warnings=" + warnings + '}';
    }
}
