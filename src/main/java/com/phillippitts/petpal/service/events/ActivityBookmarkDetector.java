package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.config.properties.EventPipelineProperties;
import com.phillippitts.petpal.domain.ArtifactKind;
import com.phillippitts.petpal.domain.ArtifactRequest;
import com.phillippitts.petpal.domain.Detection;
import com.phillippitts.petpal.domain.DetectionFrame;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Requests a bookmark when activity stays high for a while.
 *
 * <p>Each frame is scored {@code 0.2 * subjects + max(action confidence) + 0.3 * objects}. A bookmark
 * is requested when the current score exceeds the threshold, enough scores are recorded and the
 * recent mean exceeds the sustained average; the history is then cleared so one burst yields one
 * bookmark.
 */
public final class ActivityBookmarkDetector {

    static final String REASON = "Significant activity detected";

    private final EventPipelineProperties.MotionBookmark settings;
    private final Deque<Double> scores = new ArrayDeque<>();

    public ActivityBookmarkDetector(EventPipelineProperties.MotionBookmark settings) {
        this.settings = settings;
    }

    static double score(DetectionFrame frame) {
        double maxAction = frame.actions().stream().mapToDouble(Detection::confidence).max().orElse(0.0);
        return 0.2 * frame.subjects().size() + maxAction + 0.3 * frame.objects().size();
    }

    /**
     * Scores a frame and returns a bookmark request if the activity rule fires.
     */
    public synchronized Optional<ArtifactRequest> onFrame(DetectionFrame frame) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        double current = score(frame);
        scores.addLast(current);
        while (scores.size() > settings.getHistorySize()) {
            scores.removeFirst();
        }

        if (current <= settings.getScoreThreshold()
                || scores.size() <= settings.getSustainedWindow()
                || recentMean() <= settings.getSustainedAverage()) {
            return Optional.empty();
        }

        scores.clear();
        return Optional.of(new ArtifactRequest(UUID.randomUUID(), ArtifactKind.BOOKMARK, "activity", REASON,
                List.of("activity", "auto_bookmark"), frame.ownerId(), frame.observedAt(),
                frame.observedAt(), frame.observedAt(), frame.mediaTimestampMs(), frame.mediaTimestampMs()));
    }

    private double recentMean() {
        int window = settings.getSustainedWindow();
        double sum = 0.0;
        int n = 0;
        Iterator<Double> it = scores.descendingIterator();
        while (it.hasNext() && n < window) {
            sum += it.next();
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }
}
