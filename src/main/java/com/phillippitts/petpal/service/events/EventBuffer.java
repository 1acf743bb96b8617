package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory buffer of events awaiting the next flush.
 *
 * <p>Bounded to {@code maxBuffered}: when full, the oldest event is dropped with a warning. This only
 * happens while the sink keeps failing and batches are being requeued.
 */
public final class EventBuffer {

    private static final Logger LOG = LogManager.getLogger(EventBuffer.class);

    private final ConcurrentLinkedDeque<ActivityEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicLong dropped = new AtomicLong();
    private final int maxBuffered;

    public EventBuffer(int maxBuffered) {
        if (maxBuffered < 1) {
            throw new IllegalArgumentException("maxBuffered must be >= 1, got: " + maxBuffered);
        }
        this.maxBuffered = maxBuffered;
    }

    public void append(ActivityEvent event) {
        events.addLast(event);
        size.incrementAndGet();
        trim();
    }

    /**
     * Removes and returns everything currently buffered, oldest first.
     */
    public List<ActivityEvent> drain() {
        List<ActivityEvent> batch = new ArrayList<>();
        ActivityEvent next;
        while ((next = events.pollFirst()) != null) {
            size.decrementAndGet();
            batch.add(next);
        }
        return batch;
    }

    /**
     * Puts a failed batch back in front of anything appended since, preserving order.
     */
    public void requeue(List<ActivityEvent> batch) {
        ListIterator<ActivityEvent> it = batch.listIterator(batch.size());
        while (it.hasPrevious()) {
            events.addFirst(it.previous());
            size.incrementAndGet();
        }
        trim();
    }

    public int size() {
        return Math.max(0, size.get());
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void trim() {
        int over = 0;
        while (size.get() > maxBuffered && events.pollFirst() != null) {
            size.decrementAndGet();
            over++;
        }
        if (over > 0) {
            long total = dropped.addAndGet(over);
            LOG.warn("Event buffer full ({}); dropped {} oldest events (total dropped={})", maxBuffered, over, total);
        }
    }
}
