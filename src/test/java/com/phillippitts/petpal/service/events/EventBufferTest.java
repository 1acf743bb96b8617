package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.domain.ActivityEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBufferTest {

    private static ActivityEvent event(String type) {
        return ActivityEvent.of("owner-1", Instant.parse("2025-06-01T12:00:00Z"), type, Map.of(), null);
    }

    @Test
    void shouldDrainInAppendOrder() {
        // Arrange
        EventBuffer buffer = new EventBuffer(10);
        buffer.append(event("a"));
        buffer.append(event("b"));

        // Act
        List<ActivityEvent> drained = buffer.drain();

        // Assert
        assertThat(drained).extracting(ActivityEvent::type).containsExactly("a", "b");
        assertThat(buffer.size()).isZero();
        assertThat(buffer.drain()).isEmpty();
    }

    @Test
    void shouldDropOldestWhenFull() {
        // Arrange
        EventBuffer buffer = new EventBuffer(3);

        // Act
        for (String type : List.of("a", "b", "c", "d", "e")) {
            buffer.append(event(type));
        }

        // Assert
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.droppedCount()).isEqualTo(2);
        assertThat(buffer.drain()).extracting(ActivityEvent::type).containsExactly("c", "d", "e");
    }

    @Test
    void shouldTrimOldestRequeuedEventsWhenFull() {
        // Arrange
        EventBuffer buffer = new EventBuffer(3);
        buffer.append(event("c"));
        buffer.append(event("d"));

        // Act
        buffer.requeue(List.of(event("a"), event("b")));

        // Assert
        assertThat(buffer.droppedCount()).isEqualTo(1);
        assertThat(buffer.drain()).extracting(ActivityEvent::type).containsExactly("b", "c", "d");
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new EventBuffer(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBuffered");
    }
}
