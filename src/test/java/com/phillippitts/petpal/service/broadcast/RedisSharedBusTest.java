package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.StatusNotification;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;

import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.RecordingBus;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.RecordingSink;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSharedBusTest {

    private static final String CHANNEL = "petpal:notifications";

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final NotificationCodec codec = new NotificationCodec();
    private final List<Object> events = new CopyOnWriteArrayList<>();

    private RedisSharedBus bus(String instanceId) {
        return new RedisSharedBus(redis, CHANNEL, instanceId, codec, Runnable::run, events::add);
    }

    @Test
    void shouldPublishEnvelopeTaggedWithOrigin() {
        // Arrange
        RedisSharedBus bus = bus("node-a");
        StatusNotification notification = status("r1", "Phase approach");

        // Act
        bus.publish(notification);

        // Assert
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(redis).convertAndSend(eq(CHANNEL), payload.capture());
        JSONObject envelope = new JSONObject((String) payload.getValue());
        assertThat(envelope.getString("origin")).isEqualTo("node-a");
        assertThat(codec.decode(envelope.getJSONObject("notification").toString())).isEqualTo(notification);
    }

    @Test
    void shouldDegradeOnceAndRecoverOnNextSuccessfulPublish() {
        // Arrange
        RedisSharedBus bus = bus("node-a");
        when(redis.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"))
                .thenThrow(new RedisConnectionFailureException("connection refused"))
                .thenReturn(1L);

        // Act
        bus.publish(status("r1", "one"));
        bus.publish(status("r1", "two"));

        // Assert
        assertThat(bus.isAvailable()).isFalse();
        assertThat(events).hasSize(1).first().isInstanceOf(BusFanoutDegradedEvent.class);

        // Act
        bus.publish(status("r1", "three"));

        // Assert
        assertThat(bus.isAvailable()).isTrue();
        assertThat(events).hasSize(1);
    }

    @Test
    void shouldNotFailPublishWhenForwarderIsSaturated() {
        RedisSharedBus bus = new RedisSharedBus(redis, CHANNEL, "node-a", codec, task -> {
            throw new RejectedExecutionException("full");
        }, events::add);

        bus.publish(status("r1", "one"));

        assertThat(bus.isAvailable()).isFalse();
        assertThat(events).hasSize(1);
    }

    @Test
    void shouldKeepLocalBroadcastWorkingWhileBusIsDown() {
        // Arrange
        doThrow(new RedisConnectionFailureException("down")).when(redis).convertAndSend(anyString(), anyString());
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, bus("node-a"), null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);

        // Act
        hub.publish(status("r1", "still local"));

        // Assert
        assertThat(sink.received).hasSize(1);
        assertThat(hub.getBus().isAvailable()).isFalse();
    }

    @Test
    void shouldDeliverSiblingMessagesLocallyAndDropOwnMessages() {
        // Arrange
        doReturn(1L).when(redis).convertAndSend(anyString(), anyString());
        RecordingBus outbound = new RecordingBus();
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, outbound, null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);
        SharedBusListener listener = new SharedBusListener(hub, codec, "node-a");
        StatusNotification fromSibling = status("r1", "remote");

        // Act
        listener.handle(bus("node-a").wrap(status("r1", "echo of our own publish")));
        listener.handle(bus("node-b").wrap(fromSibling));

        // Assert
        assertThat(sink.received).containsExactly(fromSibling);
        assertThat(outbound.published).isEmpty();
    }

    @Test
    void shouldDropMalformedBusMessages() {
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, null, null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);
        SharedBusListener listener = new SharedBusListener(hub, codec, "node-a");

        listener.handle("not json");
        listener.handle("{\"origin\":\"node-b\",\"notification\":{\"type\":\"bogus\"}}");

        assertThat(sink.received).isEmpty();
    }
}
