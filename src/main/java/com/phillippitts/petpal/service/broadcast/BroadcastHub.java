package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.service.metrics.BroadcastMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans out status and event notifications to every connected subscriber and, when configured,
 * mirrors them through the shared bus.
 *
 * <p><b>Delivery model:</b> {@link #publish} only enqueues. Each subscriber owns a bounded FIFO
 * queue drained by a task on the broadcast pool; at most one drain task per subscriber runs at a
 * time, which preserves per-subscriber publish order. A slow connection therefore never blocks the
 * publisher or the other subscribers while the pool has room; when the pool rejects a drain, the
 * publishing thread drains that subscriber itself. A subscriber whose queue overflows, or whose
 * sink fails on write, is pruned.
 *
 * <p><b>Multi-instance:</b> locally published notifications are handed to the {@link SharedBus};
 * notifications arriving from the bus go through {@link #deliverFromBus}, which delivers locally and
 * never republishes, so a message crosses the bus at most once.
 *
 * <p><b>Thread Safety:</b> lock-free; the subscriber set is a concurrent map and publishing holds
 * no lock across sink I/O.
 *
 * @since 1.0
 */
public final class BroadcastHub {

    private static final Logger LOG = LogManager.getLogger(BroadcastHub.class);

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Executor executor;
    private final int queueCapacity;
    private final SharedBus bus;
    private final BroadcastMetrics metrics;

    /**
     * @param executor      pool running per-subscriber drain tasks
     * @param queueCapacity per-subscriber queue bound
     * @param bus           shared bus, {@link NoopSharedBus#INSTANCE} for single-instance
     * @param metrics       metrics (nullable for tests)
     */
    public BroadcastHub(Executor executor, int queueCapacity, SharedBus bus, BroadcastMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + queueCapacity);
        }
        this.executor = Objects.requireNonNull(executor, "executor");
        this.queueCapacity = queueCapacity;
        this.bus = bus != null ? bus : NoopSharedBus.INSTANCE;
        this.metrics = metrics;
    }

    /**
     * Handle returned by {@link #subscribe}.
     */
    public record Subscription(String id) {
    }

    /**
     * Attaches a subscriber. Delivery starts with the next publish; nothing is replayed.
     *
     * @param sink            connection to deliver to
     * @param requestIdFilter restricts delivery to status notifications of one request, nullable
     */
    public Subscription subscribe(SubscriberSink sink, String requestIdFilter) {
        Objects.requireNonNull(sink, "sink");
        String id = UUID.randomUUID().toString();
        String filter = (requestIdFilter == null || requestIdFilter.isBlank()) ? null : requestIdFilter;
        subscribers.put(id, new Subscriber(id, filter, sink, queueCapacity));
        LOG.debug("Subscriber {} attached (filter={}, total={})", id, filter, subscribers.size());
        return new Subscription(id);
    }

    /**
     * Detaches a subscriber and closes its sink. Unknown ids are ignored.
     */
    public void unsubscribe(String subscriptionId) {
        Subscriber removed = subscribers.remove(subscriptionId);
        if (removed != null && removed.markClosed()) {
            closeQuietly(removed);
            LOG.debug("Subscriber {} detached (total={})", subscriptionId, subscribers.size());
        }
    }

    /**
     * Publishes a locally produced notification to local subscribers and the shared bus.
     */
    public void publish(Notification notification) {
        deliverLocally(notification, "local");
        bus.publish(notification);
    }

    /**
     * Delivers a notification received from the shared bus to local subscribers only.
     */
    public void deliverFromBus(Notification notification) {
        deliverLocally(notification, "bus");
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public SharedBus getBus() {
        return bus;
    }

    private void deliverLocally(Notification notification, String origin) {
        Objects.requireNonNull(notification, "notification");
        for (Subscriber subscriber : subscribers.values()) {
            if (!subscriber.accepts(notification)) {
                continue;
            }
            if (!subscriber.queue().offer(notification)) {
                prune(subscriber, "queue full");
                continue;
            }
            scheduleDrain(subscriber);
        }
        if (metrics != null) {
            metrics.incrementPublished(notification.type().name().toLowerCase(Locale.ROOT), origin);
        }
    }

    private void scheduleDrain(Subscriber subscriber) {
        if (!subscriber.tryStartDrain()) {
            return;
        }
        try {
            executor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException e) {
            LOG.warn("Broadcast pool saturated; draining {} on publishing thread", subscriber.id());
            drain(subscriber);
        }
    }

    private void drain(Subscriber subscriber) {
        try {
            Notification next;
            while (!subscriber.isClosed() && (next = subscriber.queue().poll()) != null) {
                subscriber.sink().send(next);
            }
        } catch (IOException | RuntimeException e) {
            prune(subscriber, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            subscriber.endDrain();
        }
        if (!subscriber.isClosed() && !subscriber.queue().isEmpty()) {
            scheduleDrain(subscriber);
        }
    }

    private void prune(Subscriber subscriber, String reason) {
        if (!subscriber.markClosed()) {
            return;
        }
        subscribers.remove(subscriber.id(), subscriber);
        subscriber.queue().clear();
        closeQuietly(subscriber);
        if (metrics != null) {
            metrics.incrementPruned();
        }
        LOG.info("Pruned subscriber {} ({}); remaining={}", subscriber.id(), reason, subscribers.size());
    }

    private static void closeQuietly(Subscriber subscriber) {
        try {
            subscriber.sink().close();
        } catch (RuntimeException e) {
            LOG.debug("Closing subscriber {} failed: {}", subscriber.id(), e.getMessage());
        }
    }
}
