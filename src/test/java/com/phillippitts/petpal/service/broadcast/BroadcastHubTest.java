package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.EventNotification;
import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.domain.StatusNotification;
import com.phillippitts.petpal.service.metrics.BroadcastMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.BlockingSink;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.FailingSink;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.RecordingBus;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.RecordingSink;
import static com.phillippitts.petpal.service.broadcast.BroadcastTestDoubles.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BroadcastHubTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldDeliverEveryNotificationInPublishOrder() {
        // Arrange
        BroadcastHub hub = new BroadcastHub(pool, 256, null, null);
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        hub.subscribe(first, null);
        hub.subscribe(second, null);
        List<Notification> sent = new ArrayList<>();

        // Act
        for (int i = 0; i < 50; i++) {
            StatusNotification n = status("r1", "step " + i);
            sent.add(n);
            hub.publish(n);
        }

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> second.received.size() == 50 && first.received.size() == 50);
        assertThat(first.received).containsExactlyElementsOf(sent);
        assertThat(second.received).containsExactlyElementsOf(sent);
    }

    @Test
    void shouldPruneStalledSubscriberWithoutDelayingOthers() {
        // Arrange
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BroadcastHub hub = new BroadcastHub(pool, 4, null, new BroadcastMetrics(registry));
        BlockingSink stalled = new BlockingSink();
        RecordingSink healthy = new RecordingSink();
        hub.subscribe(stalled, null);
        hub.subscribe(healthy, null);

        // Act
        for (int i = 0; i < 20; i++) {
            hub.publish(status("r1", "step " + i));
        }

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> healthy.received.size() == 20);
        assertThat(stalled.closed.get()).isTrue();
        assertThat(hub.subscriberCount()).isEqualTo(1);
        assertThat(registry.get("petpal.broadcast.pruned").counter().count()).isEqualTo(1.0);
        stalled.release.countDown();
    }

    @Test
    void shouldPruneSubscriberWhoseConnectionFails() {
        // Arrange
        BroadcastHub hub = new BroadcastHub(pool, 16, null, null);
        FailingSink broken = new FailingSink();
        hub.subscribe(broken, null);

        // Act
        hub.publish(status("r1", "hello"));

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> hub.subscriberCount() == 0);
        assertThat(broken.closed.get()).isTrue();
    }

    @Test
    void shouldRestrictFilteredSubscriberToItsRequestStatus() {
        // Arrange
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, null, null);
        RecordingSink filtered = new RecordingSink();
        hub.subscribe(filtered, "r1");
        StatusNotification mine = status("r1", "mine");

        // Act
        hub.publish(mine);
        hub.publish(status("r2", "other"));
        hub.publish(new EventNotification("dog_detected", Map.of("confidence", 0.9), null, null));

        // Assert
        assertThat(filtered.received).containsExactly(mine);
    }

    @Test
    void shouldMirrorLocalPublishesToBusButNeverBusDeliveries() {
        // Arrange
        RecordingBus bus = new RecordingBus();
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, bus, null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);
        StatusNotification local = status("r1", "local");
        StatusNotification remote = status("r2", "remote");

        // Act
        hub.publish(local);
        hub.deliverFromBus(remote);

        // Assert
        assertThat(sink.received).containsExactly(local, remote);
        assertThat(bus.published).containsExactly(local);
    }

    @Test
    void shouldNotReplayHistoryToLateSubscriber() {
        // Arrange
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, null, null);
        hub.publish(status("r1", "before"));
        RecordingSink late = new RecordingSink();

        // Act
        hub.subscribe(late, null);
        StatusNotification after = status("r1", "after");
        hub.publish(after);

        // Assert
        assertThat(late.received).containsExactly(after);
    }

    @Test
    void shouldCloseSinkOnUnsubscribe() {
        BroadcastHub hub = new BroadcastHub(Runnable::run, 16, null, null);
        RecordingSink sink = new RecordingSink();
        BroadcastHub.Subscription subscription = hub.subscribe(sink, null);

        hub.unsubscribe(subscription.id());
        hub.unsubscribe("unknown");

        assertThat(sink.closed.get()).isTrue();
        assertThat(hub.subscriberCount()).isZero();
    }

    @Test
    void shouldDeliverTerminalStatusWhenPoolRejectsEveryDrain() {
        // Arrange
        BroadcastHub hub = new BroadcastHub(task -> {
            throw new RejectedExecutionException("saturated");
        }, 16, null, null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);
        StatusNotification terminal = status("r1", "Completed: sit");

        // Act
        hub.publish(terminal);

        // Assert
        assertThat(sink.received).containsExactly(terminal);
        assertThat(hub.subscriberCount()).isEqualTo(1);
    }

    @Test
    void shouldKeepPublishOrderWhenPoolRejectsOnlySomeDrains() {
        // Arrange
        boolean[] reject = {true};
        BroadcastHub hub = new BroadcastHub(task -> {
            if (reject[0]) {
                throw new RejectedExecutionException("saturated");
            }
            task.run();
        }, 16, null, null);
        RecordingSink sink = new RecordingSink();
        hub.subscribe(sink, null);
        StatusNotification first = status("r1", "first");
        StatusNotification second = status("r1", "second");

        // Act
        hub.publish(first);
        reject[0] = false;
        hub.publish(second);

        // Assert
        assertThat(sink.received).containsExactly(first, second);
    }
}
