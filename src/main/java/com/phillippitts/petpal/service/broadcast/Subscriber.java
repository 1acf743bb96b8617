package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live connection to the hub: identity, optional request filter and a bounded FIFO delivery
 * queue drained by at most one task at a time.
 */
final class Subscriber {

    private final String id;
    private final String requestIdFilter;
    private final SubscriberSink sink;
    private final BlockingQueue<Notification> queue;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Subscriber(String id, String requestIdFilter, SubscriberSink sink, int capacity) {
        this.id = id;
        this.requestIdFilter = requestIdFilter;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    String id() {
        return id;
    }

    SubscriberSink sink() {
        return sink;
    }

    BlockingQueue<Notification> queue() {
        return queue;
    }

    /**
     * Unfiltered subscribers get everything; a filtered subscriber only gets status notifications
     * for its request.
     */
    boolean accepts(Notification notification) {
        if (requestIdFilter == null) {
            return true;
        }
        return notification.type() == Notification.Type.STATUS
                && requestIdFilter.equals(notification.requestId());
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * @return {@code true} on the first call only
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }
}
