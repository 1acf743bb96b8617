package com.phillippitts.petpal.presentation.controller;

import com.phillippitts.petpal.config.properties.BroadcastProperties;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import com.phillippitts.petpal.service.broadcast.SseSubscriberSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Push channel: one long-lived SSE stream per subscriber.
 *
 * <p>No history is replayed; a late subscriber reads the current state from {@code /status}.
 */
@RestController
class EventStreamController {

    private static final Logger log = LogManager.getLogger(EventStreamController.class);

    private final BroadcastHub hub;
    private final NotificationCodec codec;
    private final BroadcastProperties props;

    EventStreamController(BroadcastHub hub, NotificationCodec codec, BroadcastProperties props) {
        this.hub = hub;
        this.codec = codec;
        this.props = props;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter events(@RequestParam(name = "requestId", required = false) String requestId) {
        SseEmitter emitter = new SseEmitter(props.getSseTimeoutMs());
        BroadcastHub.Subscription subscription = hub.subscribe(new SseSubscriberSink(emitter, codec), requestId);
        emitter.onCompletion(() -> hub.unsubscribe(subscription.id()));
        emitter.onTimeout(() -> {
            hub.unsubscribe(subscription.id());
            emitter.complete();
        });
        emitter.onError(e -> {
            log.debug("Push stream {} errored: {}", subscription.id(), e.toString());
            hub.unsubscribe(subscription.id());
        });
        log.info("Push subscriber {} connected (filter={})", subscription.id(), requestId);
        return emitter;
    }
}
