package com.phillippitts.petpal.domain;

/**
 * Message fanned out to observers: either a command status transition or a newly created event.
 *
 * @see StatusNotification
 * @see EventNotification
 */
public interface Notification {

    enum Type { STATUS, EVENT }

    Type type();

    /**
     * Request identifier this notification is about, or {@code null} for event notifications.
     */
    default String requestId() {
        return null;
    }
}
