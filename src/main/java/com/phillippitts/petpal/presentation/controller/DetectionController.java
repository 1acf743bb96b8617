package com.phillippitts.petpal.presentation.controller;

import com.phillippitts.petpal.domain.ActivityEvent;
import com.phillippitts.petpal.domain.Detection;
import com.phillippitts.petpal.domain.DetectionFrame;
import com.phillippitts.petpal.exception.InvalidCommandException;
import com.phillippitts.petpal.service.events.DetectionIngestor;
import com.phillippitts.petpal.service.events.EventSink;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Detector ingestion and the recent-events query.
 */
@RestController
class DetectionController {

    static final int MAX_EVENT_LIMIT = 500;

    private final DetectionIngestor ingestor;
    private final EventSink sink;

    DetectionController(DetectionIngestor ingestor, EventSink sink) {
        this.ingestor = ingestor;
        this.sink = sink;
    }

    @PostMapping("/api/detections")
    ResponseEntity<Map<String, Object>> ingest(@RequestBody DetectionFrameRequest request) {
        if (request == null) {
            throw new InvalidCommandException("detection frame body is required");
        }
        List<ActivityEvent> events;
        try {
            events = ingestor.ingest(request.toFrame());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidCommandException("malformed detection frame: " + e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "status", "accepted",
                "events", events.stream().map(ActivityEvent::type).toList()
        ));
    }

    @GetMapping("/api/events")
    ResponseEntity<List<ActivityEvent>> recentEvents(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_EVENT_LIMIT) {
            throw new InvalidCommandException("limit must be between 1 and " + MAX_EVENT_LIMIT);
        }
        return ResponseEntity.ok(sink.recentEvents(limit));
    }

    /**
     * Wire form of one detector output frame.
     */
    record DetectionFrameRequest(String ownerId,
                                 Instant observedAt,
                                 Long mediaTimestampMs,
                                 List<Detection> subjects,
                                 List<Detection> actions,
                                 List<Detection> objects) {

        DetectionFrame toFrame() {
            return new DetectionFrame(ownerId, observedAt, mediaTimestampMs, subjects, actions, objects);
        }
    }
}
