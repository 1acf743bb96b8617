package com.phillippitts.petpal.service.events;

import java.util.List;
import java.util.Objects;

/**
 * Two-step temporal pattern: {@code first} followed by {@code second} no later than
 * {@code windowMs} afterwards.
 *
 * @param name     trigger reason reported on the artifact (e.g. {@code fetch_return})
 * @param first    opening action label
 * @param second   closing action label
 * @param windowMs maximum delay between the two
 * @param labels   tags attached to the resulting clip
 */
public record SequencePattern(String name, String first, String second, long windowMs, List<String> labels) {

    public SequencePattern {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0, got: " + windowMs);
        }
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
