package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import com.phillippitts.petpal.domain.ArtifactRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Default sink keeping the most recent events and artifact requests in memory. Used when no
 * database-backed sink is configured.
 */
public class InMemoryEventSink implements EventSink {

    private final int capacity;
    private final Deque<ActivityEvent> events = new ArrayDeque<>();
    private final Deque<ArtifactRequest> artifacts = new ArrayDeque<>();

    public InMemoryEventSink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void appendBatch(List<ActivityEvent> batch) {
        for (ActivityEvent event : batch) {
            events.addLast(event);
            if (events.size() > capacity) {
                events.removeFirst();
            }
        }
    }

    @Override
    public synchronized void appendArtifactRequest(ArtifactRequest request) {
        artifacts.addLast(request);
        if (artifacts.size() > capacity) {
            artifacts.removeFirst();
        }
    }

    @Override
    public synchronized List<ActivityEvent> recentEvents(int limit) {
        return newestFirst(events, limit);
    }

    /**
     * Most recent artifact requests, newest first.
     */
    public synchronized List<ArtifactRequest> recentArtifacts(int limit) {
        return newestFirst(artifacts, limit);
    }

    private static <T> List<T> newestFirst(Deque<T> source, int limit) {
        List<T> result = new ArrayList<>(Math.min(Math.max(limit, 0), source.size()));
        Iterator<T> it = source.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }
}
