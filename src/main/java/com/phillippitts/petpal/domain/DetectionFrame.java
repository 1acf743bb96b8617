package com.phillippitts.petpal.domain;

import java.time.Instant;
import java.util.List;

/**
 * One frame's worth of raw detector output, as it arrives from the vision pipeline.
 *
 * @param ownerId          owner/session the frame belongs to, nullable
 * @param observedAt       capture time; defaults to now
 * @param mediaTimestampMs position of the frame in the recorded media, nullable
 * @param subjects         subject detections (e.g. the dog)
 * @param actions          recognized actions (e.g. {@code approach}, {@code eating})
 * @param objects          other objects in view (e.g. ball, bowl)
 */
public record DetectionFrame(
        String ownerId,
        Instant observedAt,
        Long mediaTimestampMs,
        List<Detection> subjects,
        List<Detection> actions,
        List<Detection> objects
) {

    public DetectionFrame {
        observedAt = observedAt == null ? Instant.now() : observedAt;
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        actions = actions == null ? List.of() : List.copyOf(actions);
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public static DetectionFrame ofActions(String ownerId, Instant observedAt, Detection... actions) {
        return new DetectionFrame(ownerId, observedAt, null, List.of(), List.of(actions), List.of());
    }
}
