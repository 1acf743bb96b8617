package com.phillippitts.petpal.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Request for the media pipeline to materialize a bookmark or clip.
 *
 * <p>For clips, {@code start}/{@code end} are already clamped to the configured duration bounds.
 * Bookmarks are points in time: start, end and anchor coincide and the duration is zero.
 *
 * @param id                   generated identifier
 * @param kind                 clip or bookmark
 * @param triggerReason        pattern or rule that produced the request (e.g. {@code fetch_return})
 * @param label                descriptive label
 * @param labels               tags attached to the artifact
 * @param ownerId              owner/session reference, nullable
 * @param anchorTimestamp      timestamp the artifact is anchored to
 * @param start                clip start
 * @param end                  clip end
 * @param startMediaTimestampMs media timestamp of the start, nullable
 * @param endMediaTimestampMs   media timestamp of the end, nullable
 */
public record ArtifactRequest(
        UUID id,
        ArtifactKind kind,
        String triggerReason,
        String label,
        List<String> labels,
        String ownerId,
        Instant anchorTimestamp,
        Instant start,
        Instant end,
        Long startMediaTimestampMs,
        Long endMediaTimestampMs
) {

    public ArtifactRequest {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(anchorTimestamp, "anchorTimestamp must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Artifact end " + end + " is before start " + start);
        }
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public long durationMs() {
        return Duration.between(start, end).toMillis();
    }
}
