package com.phillippitts.petpal.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Newly created activity event pushed to observers.
 *
 * @param eventType        event type
 * @param data             event payload
 * @param mediaTimestampMs associated media timestamp, nullable
 * @param timestamp        event time
 */
public record EventNotification(
        String eventType,
        Map<String, Object> data,
        Long mediaTimestampMs,
        Instant timestamp
) implements Notification {

    public EventNotification {
        Objects.requireNonNull(eventType, "eventType must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static EventNotification from(ActivityEvent event) {
        return new EventNotification(event.type(), event.data(), event.mediaTimestampMs(), event.timestamp());
    }

    @Override
    public Type type() {
        return Type.EVENT;
    }
}
