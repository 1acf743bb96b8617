package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.config.properties.EventPipelineProperties;
import com.phillippitts.petpal.domain.ActivityEvent;
import com.phillippitts.petpal.domain.ArtifactRequest;
import com.phillippitts.petpal.domain.Detection;
import com.phillippitts.petpal.domain.DetectionFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns detector output into events and derived artifact requests.
 *
 * <p>Per frame:
 * <ul>
 *   <li>subject detections above threshold become {@code dog_detected} (type follows the configured
 *       subject label)</li>
 *   <li>actions above threshold become events typed by the action label and feed the
 *       {@link SequenceMatcher}; each match is handed to the sink and recorded as
 *       {@code clip_requested}, or as {@code artifact_request_failed} when the sink rejects it</li>
 *   <li>objects above threshold become {@code object_detected_<label>}</li>
 *   <li>the frame is scored by the {@link ActivityBookmarkDetector}; a bookmark is handed to the sink
 *       and recorded as {@code bookmark}</li>
 * </ul>
 */
public final class DetectionIngestor {

    private static final Logger LOG = LogManager.getLogger(DetectionIngestor.class);

    static final String CLIP_REQUESTED = "clip_requested";
    static final String BOOKMARK = "bookmark";
    static final String ARTIFACT_REQUEST_FAILED = "artifact_request_failed";

    private final EventPipelineProperties properties;
    private final EventRecorder recorder;
    private final SequenceMatcher matcher;
    private final ActivityBookmarkDetector bookmarks;
    private final EventSink sink;

    public DetectionIngestor(EventPipelineProperties properties,
                             EventRecorder recorder,
                             SequenceMatcher matcher,
                             ActivityBookmarkDetector bookmarks,
                             EventSink sink) {
        this.properties = properties;
        this.recorder = recorder;
        this.matcher = matcher;
        this.bookmarks = bookmarks;
        this.sink = sink;
    }

    /**
     * Processes one frame.
     *
     * @return events created for this frame, in creation order
     */
    public List<ActivityEvent> ingest(DetectionFrame frame) {
        List<ActivityEvent> created = new ArrayList<>();
        String subjectLabel = properties.getSubjectLabel();

        for (Detection subject : frame.subjects()) {
            if (subjectLabel.equals(subject.label()) && subject.confidence() > properties.getSubjectConfidence()) {
                created.add(emit(frame, subjectLabel + "_detected", detectionData(subject)));
            }
        }

        for (Detection action : frame.actions()) {
            if (action.confidence() <= properties.getActionConfidence()) {
                continue;
            }
            String label = normalize(action.label());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("confidence", action.confidence());
            data.put("action", label);
            created.add(emit(frame, label, data));

            for (ArtifactRequest clip : matcher.onAction(frame.ownerId(), label, frame.observedAt(),
                    frame.mediaTimestampMs())) {
                created.add(handOff(frame, clip, CLIP_REQUESTED, clipData(clip)));
            }
        }

        for (Detection object : frame.objects()) {
            if (object.confidence() > properties.getObjectConfidence()) {
                created.add(emit(frame, "object_detected_" + normalize(object.label()), detectionData(object)));
            }
        }

        Optional<ArtifactRequest> bookmark = bookmarks.onFrame(frame);
        if (bookmark.isPresent()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("artifactId", bookmark.get().id().toString());
            data.put("reason", bookmark.get().label());
            created.add(handOff(frame, bookmark.get(), BOOKMARK, data));
        }
        return created;
    }

    private ActivityEvent emit(DetectionFrame frame, String type, Map<String, Object> data) {
        ActivityEvent event = ActivityEvent.of(frame.ownerId(), frame.observedAt(), type, data,
                frame.mediaTimestampMs());
        recorder.record(event);
        return event;
    }

    /**
     * Hands the request to the sink and records {@code type} only once the sink has taken it; a
     * rejected request is recorded as {@code artifact_request_failed} instead.
     */
    private ActivityEvent handOff(DetectionFrame frame, ArtifactRequest request, String type,
                                  Map<String, Object> data) {
        try {
            sink.appendArtifactRequest(request);
        } catch (RuntimeException e) {
            LOG.error("Artifact request {} ({}) could not be handed off: {}",
                    request.id(), request.triggerReason(), e.getMessage());
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("artifactId", request.id().toString());
            failure.put("requested", type);
            failure.put("trigger", request.triggerReason());
            failure.put("error", String.valueOf(e.getMessage()));
            return emit(frame, ARTIFACT_REQUEST_FAILED, failure);
        }
        return emit(frame, type, data);
    }

    private static Map<String, Object> detectionData(Detection detection) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("label", detection.label());
        data.put("confidence", detection.confidence());
        if (detection.geometry() != null) {
            Map<String, Object> box = new LinkedHashMap<>();
            box.put("x", detection.geometry().x());
            box.put("y", detection.geometry().y());
            box.put("width", detection.geometry().width());
            box.put("height", detection.geometry().height());
            data.put("bbox", box);
        }
        return data;
    }

    private static Map<String, Object> clipData(ArtifactRequest clip) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("artifactId", clip.id().toString());
        data.put("trigger", clip.triggerReason());
        data.put("label", clip.label());
        data.put("labels", clip.labels());
        data.put("start", clip.start().toString());
        data.put("end", clip.end().toString());
        data.put("durationMs", clip.durationMs());
        data.put("startMediaTimestamp", clip.startMediaTimestampMs());
        data.put("endMediaTimestamp", clip.endMediaTimestampMs());
        return data;
    }

    private static String normalize(String label) {
        return label.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
