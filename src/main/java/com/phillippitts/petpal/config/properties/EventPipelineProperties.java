package com.phillippitts.petpal.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the detection-to-event pipeline: derivation thresholds, the
 * batch writer cadence, the action history used for sequence matching, clip duration bounds
 * and the motion bookmark rule.
 *
 * <p>Example:
 * <pre>
 * petpal.events.flush-interval-ms=1000
 * petpal.events.patterns[0].name=fetch_return
 * petpal.events.patterns[0].first=approach
 * petpal.events.patterns[0].second=fetch_return
 * petpal.events.patterns[0].window-ms=10000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "petpal.events")
public class EventPipelineProperties {

    /** Batch writer cadence. */
    @Positive
    private long flushIntervalMs = 1_000;

    /** Buffer cap; the oldest events are dropped beyond it while the store is failing. */
    @Positive
    private int maxBuffered = 10_000;

    /** Detector label of the monitored subject. */
    @NotBlank
    private String subjectLabel = "dog";

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double subjectConfidence = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double actionConfidence = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double objectConfidence = 0.5;

    /** Recent actions retained for sequence matching. */
    @Min(2)
    private int actionHistory = 30;

    @Positive
    private long clipMinMs = 8_000;

    @Positive
    private long clipMaxMs = 12_000;

    @Valid
    @NotEmpty
    private List<Pattern> patterns = defaultPatterns();

    @Valid
    private MotionBookmark motionBookmark = new MotionBookmark();

    private static List<Pattern> defaultPatterns() {
        List<Pattern> defaults = new ArrayList<>();
        defaults.add(new Pattern("fetch_return", "approach", "fetch_return", 10_000,
                List.of("fetch", "auto_clip")));
        defaults.add(new Pattern("treat_eaten", "approach", "eating", 5_000,
                List.of("treat", "eating", "auto_clip")));
        return defaults;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    public int getMaxBuffered() {
        return maxBuffered;
    }

    public void setMaxBuffered(int maxBuffered) {
        this.maxBuffered = maxBuffered;
    }

    public String getSubjectLabel() {
        return subjectLabel;
    }

    public void setSubjectLabel(String subjectLabel) {
        this.subjectLabel = subjectLabel;
    }

    public double getSubjectConfidence() {
        return subjectConfidence;
    }

    public void setSubjectConfidence(double subjectConfidence) {
        this.subjectConfidence = subjectConfidence;
    }

    public double getActionConfidence() {
        return actionConfidence;
    }

    public void setActionConfidence(double actionConfidence) {
        this.actionConfidence = actionConfidence;
    }

    public double getObjectConfidence() {
        return objectConfidence;
    }

    public void setObjectConfidence(double objectConfidence) {
        this.objectConfidence = objectConfidence;
    }

    public int getActionHistory() {
        return actionHistory;
    }

    public void setActionHistory(int actionHistory) {
        this.actionHistory = actionHistory;
    }

    public long getClipMinMs() {
        return clipMinMs;
    }

    public void setClipMinMs(long clipMinMs) {
        this.clipMinMs = clipMinMs;
    }

    public long getClipMaxMs() {
        return clipMaxMs;
    }

    public void setClipMaxMs(long clipMaxMs) {
        this.clipMaxMs = clipMaxMs;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public MotionBookmark getMotionBookmark() {
        return motionBookmark;
    }

    public void setMotionBookmark(MotionBookmark motionBookmark) {
        this.motionBookmark = motionBookmark;
    }

    /**
     * Two-step action pattern: {@code first} followed by {@code second} within {@code windowMs}.
     */
    public static class Pattern {

        @NotBlank
        private String name;

        @NotBlank
        private String first;

        @NotBlank
        private String second;

        @Positive
        private long windowMs;

        private List<String> labels = new ArrayList<>();

        public Pattern() {
        }

        public Pattern(String name, String first, String second, long windowMs, List<String> labels) {
            this.name = name;
            this.first = first;
            this.second = second;
            this.windowMs = windowMs;
            this.labels = new ArrayList<>(labels);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFirst() {
            return first;
        }

        public void setFirst(String first) {
            this.first = first;
        }

        public String getSecond() {
            return second;
        }

        public void setSecond(String second) {
            this.second = second;
        }

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public List<String> getLabels() {
            return labels;
        }

        public void setLabels(List<String> labels) {
            this.labels = labels == null ? new ArrayList<>() : labels;
        }
    }

    /**
     * Sustained-motion bookmark rule. A frame is scored as
     * {@code 0.2 * subjects + max(action confidence) + 0.3 * objects}; a bookmark is requested when a
     * frame scores above {@code scoreThreshold} and the mean of the last {@code sustainedWindow}
     * scores exceeds {@code sustainedAverage}.
     */
    public static class MotionBookmark {

        private boolean enabled = true;

        @Min(2)
        private int historySize = 100;

        @Positive
        private double scoreThreshold = 1.5;

        @Min(1)
        private int sustainedWindow = 10;

        @Positive
        private double sustainedAverage = 0.8;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }

        public double getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(double scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public int getSustainedWindow() {
            return sustainedWindow;
        }

        public void setSustainedWindow(int sustainedWindow) {
            this.sustainedWindow = sustainedWindow;
        }

        public double getSustainedAverage() {
            return sustainedAverage;
        }

        public void setSustainedAverage(double sustainedAverage) {
            this.sustainedAverage = sustainedAverage;
        }
    }
}
