package com.phillippitts.petpal.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only event derived from detections or from the sequence matcher.
 *
 * @param id               generated identifier
 * @param ownerId          owner/session reference
 * @param timestamp        when the event happened
 * @param type             open event type (e.g. {@code dog_detected}, {@code sit}, {@code clip_requested})
 * @param data             opaque structured payload
 * @param mediaTimestampMs associated media timestamp in milliseconds, nullable
 */
public record ActivityEvent(
        UUID id,
        String ownerId,
        Instant timestamp,
        String type,
        Map<String, Object> data,
        Long mediaTimestampMs
) {

    public ActivityEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        // payload values may be null (e.g. an unknown media timestamp)
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ActivityEvent of(String ownerId, Instant timestamp, String type,
                                   Map<String, Object> data, Long mediaTimestampMs) {
        return new ActivityEvent(UUID.randomUUID(), ownerId, timestamp, type, data, mediaTimestampMs);
    }
}
