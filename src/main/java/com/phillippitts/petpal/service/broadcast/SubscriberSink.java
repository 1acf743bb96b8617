package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;

import java.io.IOException;

/**
 * Delivery end of a subscriber connection (an SSE stream, a test recorder).
 *
 * <p>The hub never calls {@link #send} concurrently for the same sink.
 */
public interface SubscriberSink {

    /**
     * Writes one notification to the connection.
     *
     * @throws IOException if the connection is gone; the subscriber is then pruned
     */
    void send(Notification notification) throws IOException;

    /**
     * Closes the connection after the subscriber was pruned or unsubscribed.
     */
    default void close() {
    }
}
