package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ArtifactKind;
import com.phillippitts.petpal.domain.ArtifactRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Detects short temporal action patterns and turns each match into a clip request.
 *
 * <p>Keeps a rolling history of recent actions per owner, bounded both by count and by the longest
 * pattern window. When an action closes a pattern, the most recent opening action within the
 * pattern's window is paired with it. Entries up to and including the closing action are consumed,
 * so one pair yields one clip.
 *
 * <p>Clip bounds start at the opening action and end at the closing one, then are clamped to
 * [{@code clipMinMs}, {@code clipMaxMs}]: a short span is padded evenly on both sides, a long span
 * is trimmed at the end. Media timestamps receive the same adjustment.
 *
 * <p>State lives in memory only; partial matches do not survive a restart. An owner's history is
 * dropped when a match consumes it or once every retained action is older than the longest window.
 *
 * <p><b>Thread Safety:</b> all public methods are synchronized.
 */
public final class SequenceMatcher {

    private static final Logger LOG = LogManager.getLogger(SequenceMatcher.class);
    private static final String DEFAULT_OWNER = "";

    private final List<SequencePattern> patterns;
    private final int historySize;
    private final long clipMinMs;
    private final long clipMaxMs;
    private final long lookbackMs;
    private final Map<String, Deque<ActionEntry>> histories = new HashMap<>();

    private record ActionEntry(String label, Instant at, Long mediaTimestampMs) {
    }

    public SequenceMatcher(List<SequencePattern> patterns, int historySize, long clipMinMs, long clipMaxMs) {
        Objects.requireNonNull(patterns, "patterns");
        if (historySize < 2) {
            throw new IllegalArgumentException("historySize must be >= 2, got: " + historySize);
        }
        if (clipMinMs <= 0 || clipMaxMs < clipMinMs) {
            throw new IllegalArgumentException("Invalid clip bounds [" + clipMinMs + ", " + clipMaxMs + "]");
        }
        this.patterns = List.copyOf(patterns);
        this.historySize = historySize;
        this.clipMinMs = clipMinMs;
        this.clipMaxMs = clipMaxMs;
        this.lookbackMs = this.patterns.stream().mapToLong(SequencePattern::windowMs).max().orElse(0L);
    }

    /**
     * Records an action and returns the clip requests it completes.
     *
     * @param ownerId          owner/session the action belongs to, nullable
     * @param label            action label
     * @param at               action time
     * @param mediaTimestampMs media position of the action, nullable
     * @return clip requests, usually empty
     */
    public synchronized List<ArtifactRequest> onAction(String ownerId, String label, Instant at, Long mediaTimestampMs) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(at, "at");
        String key = ownerId == null ? DEFAULT_OWNER : ownerId;
        evictIdleOwners(key, at);
        Deque<ActionEntry> history = histories.computeIfAbsent(key, k -> new ArrayDeque<>());
        expire(history, at);

        ActionEntry current = new ActionEntry(label, at, mediaTimestampMs);
        List<ArtifactRequest> matches = new ArrayList<>();
        for (SequencePattern pattern : patterns) {
            if (!pattern.second().equals(label)) {
                continue;
            }
            ActionEntry opener = findOpener(history, pattern, at);
            if (opener != null) {
                matches.add(toClip(pattern, ownerId, opener, current));
                LOG.info("Pattern {} matched: {} -> {} after {}ms", pattern.name(), pattern.first(), label,
                        Duration.between(opener.at(), at).toMillis());
            }
        }

        if (matches.isEmpty()) {
            history.addLast(current);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        } else {
            // the closing action is the newest entry, so consuming through it empties the history
            histories.remove(key);
        }
        return matches;
    }

    /**
     * Number of actions currently retained for an owner.
     */
    public synchronized int historySize(String ownerId) {
        Deque<ActionEntry> history = histories.get(ownerId == null ? DEFAULT_OWNER : ownerId);
        return history == null ? 0 : history.size();
    }

    /**
     * Number of owners with retained actions.
     */
    public synchronized int ownerCount() {
        return histories.size();
    }

    private void evictIdleOwners(String activeKey, Instant now) {
        Iterator<Map.Entry<String, Deque<ActionEntry>>> it = histories.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Deque<ActionEntry>> entry = it.next();
            if (entry.getKey().equals(activeKey)) {
                continue;
            }
            expire(entry.getValue(), now);
            if (entry.getValue().isEmpty()) {
                it.remove();
                LOG.debug("Evicted idle action history for owner '{}'", entry.getKey());
            }
        }
    }

    private static ActionEntry findOpener(Deque<ActionEntry> history, SequencePattern pattern, Instant at) {
        Iterator<ActionEntry> it = history.descendingIterator();
        while (it.hasNext()) {
            ActionEntry entry = it.next();
            long delay = Duration.between(entry.at(), at).toMillis();
            if (delay > pattern.windowMs()) {
                return null;
            }
            if (delay >= 0 && entry.label().equals(pattern.first())) {
                return entry;
            }
        }
        return null;
    }

    private void expire(Deque<ActionEntry> history, Instant now) {
        while (!history.isEmpty()
                && Duration.between(history.peekFirst().at(), now).toMillis() > lookbackMs) {
            history.removeFirst();
        }
    }

    private ArtifactRequest toClip(SequencePattern pattern, String ownerId, ActionEntry opener, ActionEntry closer) {
        long span = Duration.between(opener.at(), closer.at()).toMillis();
        long padBefore = 0;
        long padAfter = 0;
        long trim = 0;
        if (span < clipMinMs) {
            long missing = clipMinMs - span;
            padBefore = missing / 2;
            padAfter = missing - padBefore;
        } else if (span > clipMaxMs) {
            trim = span - clipMaxMs;
        }

        Instant start = opener.at().minusMillis(padBefore);
        Instant end = closer.at().plusMillis(padAfter - trim);
        Long startMedia = opener.mediaTimestampMs() == null ? null : Math.max(0L, opener.mediaTimestampMs() - padBefore);
        Long endMedia = closer.mediaTimestampMs() == null ? null : closer.mediaTimestampMs() + padAfter - trim;

        return new ArtifactRequest(UUID.randomUUID(), ArtifactKind.CLIP, pattern.name(),
                pattern.name().replace('_', ' '), pattern.labels(), ownerId, opener.at(),
                start, end, startMedia, endMedia);
    }
}
