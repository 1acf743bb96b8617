package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mirrors notifications to sibling instances through a Redis pub/sub channel.
 *
 * <p>Each message is wrapped in an envelope {@code {"origin": instanceId, "notification": {...}}};
 * the inbound {@link SharedBusListener} drops envelopes carrying this instance's id.
 *
 * <p>Publishing runs on a dedicated single-thread executor, so a slow or unreachable Redis never
 * delays the caller. On failure the bus switches to degraded mode: a warning is logged and a
 * {@link BusFanoutDegradedEvent} is published once per outage; the next successful publish clears it.
 */
public final class RedisSharedBus implements SharedBus {

    private static final Logger LOG = LogManager.getLogger(RedisSharedBus.class);

    static final String ORIGIN = "origin";
    static final String NOTIFICATION = "notification";

    private final StringRedisTemplate redis;
    private final String channel;
    private final String instanceId;
    private final NotificationCodec codec;
    private final Executor forwarder;
    private final ApplicationEventPublisher publisher;
    private final AtomicBoolean available = new AtomicBoolean(true);

    public RedisSharedBus(StringRedisTemplate redis,
                          String channel,
                          String instanceId,
                          NotificationCodec codec,
                          Executor forwarder,
                          ApplicationEventPublisher publisher) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.publisher = publisher;
    }

    @Override
    public void publish(Notification notification) {
        String envelope;
        try {
            envelope = wrap(notification);
        } catch (RuntimeException e) {
            LOG.warn("Could not encode {} notification for the bus: {}", notification.type(), e.getMessage());
            return;
        }
        try {
            forwarder.execute(() -> send(envelope));
        } catch (RejectedExecutionException e) {
            markDegraded("forwarder queue full");
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getChannel() {
        return channel;
    }

    String wrap(Notification notification) {
        JSONObject envelope = new JSONObject();
        envelope.put(ORIGIN, instanceId);
        envelope.put(NOTIFICATION, new JSONObject(codec.encode(notification)));
        return envelope.toString();
    }

    private void send(String envelope) {
        try {
            redis.convertAndSend(channel, envelope);
            if (available.compareAndSet(false, true)) {
                LOG.info("Shared bus '{}' recovered; multi-instance fan-out resumed", channel);
            }
        } catch (RuntimeException e) {
            markDegraded(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void markDegraded(String reason) {
        if (available.compareAndSet(true, false)) {
            LOG.warn("Shared bus '{}' unavailable ({}); continuing local-only broadcast", channel, reason);
            if (publisher != null) {
                publisher.publishEvent(new BusFanoutDegradedEvent(channel, Instant.now(), reason));
            }
        }
    }
}
