package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.domain.EventNotification;
import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.domain.StatusNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationCodecTest {

    private final NotificationCodec codec = new NotificationCodec();

    @Test
    void shouldEncodeStatusWithSameFieldsAsStatusEndpoint() {
        // Arrange
        CommandSnapshot snapshot = new CommandSnapshot("r1", "get the treat", CommandState.TIMEOUT, "grasp",
                null, "Phase grasp did not complete within 5000ms", 5_012, List.of("detect", "approach"));

        // Act
        JSONObject json = new JSONObject(codec.encode(new StatusNotification(snapshot)));

        // Assert
        assertThat(json.getString("type")).isEqualTo("status");
        assertThat(json.getString("state")).isEqualTo("timeout");
        assertThat(json.isNull("confidence")).isTrue();
        assertThat(json.getJSONArray("completedPhases").toList()).containsExactly("detect", "approach");
        assertThat(codec.decodeSnapshot(json.toString())).isEqualTo(snapshot);
    }

    @Test
    void shouldWriteExactlyTheFieldsJacksonWritesForTheStatusBody() throws Exception {
        // Arrange
        CommandSnapshot snapshot = new CommandSnapshot("r2", "pick up the ball", CommandState.COMPLETED, "lift",
                0.91, "Completed: pick up the ball", 2_400, List.of("detect", "approach", "grasp", "lift"));

        // Act
        JSONObject restBody = new JSONObject(new ObjectMapper().writeValueAsString(snapshot));
        Set<String> pushKeys = new HashSet<>(new JSONObject(codec.encode(new StatusNotification(snapshot))).keySet());
        pushKeys.remove("type");

        // Assert
        assertThat(restBody.keySet()).isEqualTo(pushKeys).doesNotContain("terminal");
        assertThat(restBody.getString("state")).isEqualTo("completed");
    }

    @Test
    void shouldDecodeEventNotification() {
        // Arrange
        String payload = "{\"type\":\"event\",\"eventType\":\"clip_requested\",\"data\":{\"pattern\":\"fetch_return\"},"
                + "\"mediaTimestamp\":null,\"timestamp\":\"2025-01-01T00:00:00Z\"}";

        // Act
        Notification decoded = codec.decode(payload);

        // Assert
        assertThat(decoded).isInstanceOf(EventNotification.class);
        EventNotification event = (EventNotification) decoded;
        assertThat(event.eventType()).isEqualTo("clip_requested");
        assertThat(event.data()).containsEntry("pattern", "fetch_return");
        assertThat(event.mediaTimestampMs()).isNull();
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void shouldRejectUnknownTypeAndMalformedPayloads() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"alarm\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alarm");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"status\",\"state\":\"executing\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("x".repeat(1_048_577))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldEncodeEventPayload() {
        EventNotification event = new EventNotification("object_detected_ball", Map.of("confidence", 0.8), 1234L,
                Instant.parse("2025-01-01T00:00:00Z"));

        JSONObject json = new JSONObject(codec.encode(event));

        assertThat(json.getString("type")).isEqualTo("event");
        assertThat(json.getLong("mediaTimestamp")).isEqualTo(1234L);
        assertThat(json.getJSONObject("data").getDouble("confidence")).isEqualTo(0.8);
    }
}
