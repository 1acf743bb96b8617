package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import com.phillippitts.petpal.domain.EventNotification;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;

/**
 * Appends a new event to the flush buffer and announces it through the broadcast hub.
 */
public final class EventRecorder {

    private final EventBuffer buffer;
    private final BroadcastHub hub;

    public EventRecorder(EventBuffer buffer, BroadcastHub hub) {
        this.buffer = buffer;
        this.hub = hub;
    }

    public void record(ActivityEvent event) {
        buffer.append(event);
        hub.publish(EventNotification.from(event));
    }
}
