package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import com.phillippitts.petpal.domain.ArtifactRequest;

import java.util.List;

/**
 * Durable storage for events and the hand-off point for artifact requests.
 *
 * <p>Append and query only. Implementations throw on failure; the batch writer retries failed
 * batches.
 */
public interface EventSink {

    void appendBatch(List<ActivityEvent> events);

    void appendArtifactRequest(ArtifactRequest request);

    /**
     * Most recently persisted events, newest first.
     */
    List<ActivityEvent> recentEvents(int limit);
}
