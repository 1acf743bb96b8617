package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.service.broadcast.BusFanoutDegradedEvent;
import com.phillippitts.petpal.service.capability.AdapterFailureEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class OperationalEventsListenerTest {

    private final OperationalEventsListener listener = new OperationalEventsListener();

    @Test
    void shouldThrottleRepeatedKeys() {
        assertThat(listener.shouldLog("bus-petpal:notifications")).isTrue();
        assertThat(listener.shouldLog("bus-petpal:notifications")).isFalse();
        assertThat(listener.shouldLog("adapter-arm-home-timeout")).isTrue();
    }

    @Test
    void shouldHandleEventsWithoutThrowing() {
        // Arrange
        BusFanoutDegradedEvent degraded = new BusFanoutDegradedEvent("petpal:notifications", Instant.now(),
                "Connection refused");
        AdapterFailureEvent failure = new AdapterFailureEvent("detector", "detect", Instant.now(),
                "lens cap on", Map.of("reason", "failure"));

        // Act / Assert
        assertThatCode(() -> {
            listener.onBusFanoutDegraded(degraded);
            listener.onBusFanoutDegraded(degraded);
            listener.onAdapterFailure(failure);
        }).doesNotThrowAnyException();
    }
}
