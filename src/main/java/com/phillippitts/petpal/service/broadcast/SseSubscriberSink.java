package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes notifications to a Server-Sent Events stream.
 *
 * <p>Status notifications use the SSE event name {@code command_update}, event notifications
 * {@code event}; the data line is the {@link NotificationCodec} JSON.
 */
public final class SseSubscriberSink implements SubscriberSink {

    public static final String STATUS_EVENT_NAME = "command_update";
    public static final String EVENT_EVENT_NAME = "event";

    private final SseEmitter emitter;
    private final NotificationCodec codec;

    public SseSubscriberSink(SseEmitter emitter, NotificationCodec codec) {
        this.emitter = emitter;
        this.codec = codec;
    }

    @Override
    public void send(Notification notification) throws IOException {
        String name = notification.type() == Notification.Type.STATUS ? STATUS_EVENT_NAME : EVENT_EVENT_NAME;
        emitter.send(SseEmitter.event().name(name).data(codec.encode(notification)));
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
