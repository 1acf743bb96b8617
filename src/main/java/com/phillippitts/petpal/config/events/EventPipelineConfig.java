package com.phillippitts.petpal.config.events;

import com.phillippitts.petpal.config.properties.EventPipelineProperties;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.events.ActivityBookmarkDetector;
import com.phillippitts.petpal.service.events.DetectionIngestor;
import com.phillippitts.petpal.service.events.EventBatchWriter;
import com.phillippitts.petpal.service.events.EventBuffer;
import com.phillippitts.petpal.service.events.EventRecorder;
import com.phillippitts.petpal.service.events.EventSink;
import com.phillippitts.petpal.service.events.InMemoryEventSink;
import com.phillippitts.petpal.service.events.SequenceMatcher;
import com.phillippitts.petpal.service.events.SequencePattern;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the detection-to-event pipeline.
 */
@Configuration
public class EventPipelineConfig {

    private final EventPipelineProperties props;

    public EventPipelineConfig(EventPipelineProperties props) {
        this.props = props;
    }

    @Bean
    public EventBuffer eventBuffer() {
        return new EventBuffer(props.getMaxBuffered());
    }

    /**
     * In-memory sink, replaced by any other {@link EventSink} bean.
     */
    @Bean
    @ConditionalOnMissingBean(EventSink.class)
    public EventSink eventSink() {
        return new InMemoryEventSink(props.getMaxBuffered());
    }

    @Bean
    public EventBatchWriter eventBatchWriter(EventBuffer buffer, EventSink sink) {
        return new EventBatchWriter(buffer, sink);
    }

    @Bean
    public SequenceMatcher sequenceMatcher() {
        List<SequencePattern> patterns = props.getPatterns().stream()
                .map(p -> new SequencePattern(p.getName(), p.getFirst(), p.getSecond(), p.getWindowMs(),
                        p.getLabels()))
                .toList();
        return new SequenceMatcher(patterns, props.getActionHistory(), props.getClipMinMs(), props.getClipMaxMs());
    }

    @Bean
    public ActivityBookmarkDetector activityBookmarkDetector() {
        return new ActivityBookmarkDetector(props.getMotionBookmark());
    }

    @Bean
    public EventRecorder eventRecorder(EventBuffer buffer, BroadcastHub hub) {
        return new EventRecorder(buffer, hub);
    }

    @Bean
    public DetectionIngestor detectionIngestor(EventRecorder recorder,
                                               SequenceMatcher matcher,
                                               ActivityBookmarkDetector bookmarks,
                                               EventSink sink) {
        return new DetectionIngestor(props, recorder, matcher, bookmarks, sink);
    }
}
