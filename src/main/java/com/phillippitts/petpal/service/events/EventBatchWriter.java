package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flushes the event buffer to the sink on a fixed wall-clock interval, not per event.
 *
 * <p>A failed batch is put back in front of the buffer and retried on the next tick. A final flush
 * runs on shutdown.
 */
public class EventBatchWriter {

    private static final Logger LOG = LogManager.getLogger(EventBatchWriter.class);

    private final EventBuffer buffer;
    private final EventSink sink;
    private final ReentrantLock flushLock = new ReentrantLock();

    public EventBatchWriter(EventBuffer buffer, EventSink sink) {
        this.buffer = buffer;
        this.sink = sink;
    }

    /**
     * Writes everything currently buffered as one batch.
     *
     * @return number of events written, 0 if the buffer was empty or the write failed
     */
    @Scheduled(fixedRateString = "${petpal.events.flush-interval-ms:1000}")
    public int flush() {
        flushLock.lock();
        try {
            List<ActivityEvent> batch = buffer.drain();
            if (batch.isEmpty()) {
                return 0;
            }
            try {
                sink.appendBatch(batch);
                LOG.debug("Flushed {} events", batch.size());
                return batch.size();
            } catch (RuntimeException e) {
                buffer.requeue(batch);
                LOG.warn("Event flush failed ({} events requeued): {}", batch.size(), e.getMessage());
                return 0;
            }
        } finally {
            flushLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        int written = flush();
        if (buffer.size() > 0) {
            LOG.warn("Shutting down with {} unflushed events", buffer.size());
        } else if (written > 0) {
            LOG.info("Final flush wrote {} events", written);
        }
    }
}
