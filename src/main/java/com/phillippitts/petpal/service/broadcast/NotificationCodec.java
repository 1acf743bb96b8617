package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.domain.EventNotification;
import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.domain.StatusNotification;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format of notifications, shared by the SSE stream, the shared bus and the client
 * subscriber.
 *
 * <p>Formats:
 * <ul>
 *   <li><b>Status:</b> {@code {"type":"status","requestId":...,"kind":...,"state":"executing",
 *       "phase":...,"confidence":...,"message":...,"elapsedMs":...,"completedPhases":[...]}}</li>
 *   <li><b>Event:</b> {@code {"type":"event","eventType":...,"data":{...},"mediaTimestamp":...,
 *       "timestamp":"2025-01-01T00:00:00Z"}}</li>
 * </ul>
 *
 * <p>Snapshot field names match the JSON body of {@code GET /status/{id}}, so a snapshot decoded
 * from either source is identical.
 *
 * <p>Thread-safe: stateless.
 *
 * @since 1.0
 */
public final class NotificationCodec {

    /** Largest payload accepted by {@link #decode}. */
    private static final int MAX_JSON_SIZE = 1_048_576;

    static final String TYPE_STATUS = "status";
    static final String TYPE_EVENT = "event";

    public String encode(Notification notification) {
        JSONObject json;
        if (notification instanceof StatusNotification status) {
            json = snapshotToJson(status.snapshot());
            json.put("type", TYPE_STATUS);
        } else if (notification instanceof EventNotification event) {
            json = new JSONObject();
            json.put("type", TYPE_EVENT);
            json.put("eventType", event.eventType());
            json.put("data", new JSONObject(event.data()));
            json.put("mediaTimestamp", event.mediaTimestampMs() == null ? JSONObject.NULL : event.mediaTimestampMs());
            json.put("timestamp", event.timestamp().toString());
        } else {
            throw new IllegalArgumentException("Unsupported notification: " + notification.getClass().getName());
        }
        return json.toString();
    }

    /**
     * Parses a notification.
     *
     * @throws IllegalArgumentException if the payload is empty, oversized or malformed
     */
    public Notification decode(String payload) {
        JSONObject json = parse(payload);
        String type = json.optString("type", "");
        try {
            switch (type) {
                case TYPE_STATUS:
                    return new StatusNotification(snapshotFromJson(json));
                case TYPE_EVENT:
                    Map<String, Object> data = json.optJSONObject("data") == null
                            ? Map.of() : json.getJSONObject("data").toMap();
                    Long media = json.isNull("mediaTimestamp") ? null : json.getLong("mediaTimestamp");
                    Instant ts = json.has("timestamp") ? Instant.parse(json.getString("timestamp")) : null;
                    return new EventNotification(json.getString("eventType"), data, media, ts);
                default:
                    throw new IllegalArgumentException("Unknown notification type: '" + type + "'");
            }
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed " + type + " notification: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a bare snapshot, as returned by the status endpoint.
     *
     * @throws IllegalArgumentException if the payload is malformed
     */
    public CommandSnapshot decodeSnapshot(String payload) {
        JSONObject json = parse(payload);
        try {
            return snapshotFromJson(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed snapshot: " + e.getMessage(), e);
        }
    }

    JSONObject snapshotToJson(CommandSnapshot snapshot) {
        JSONObject json = new JSONObject();
        json.put("requestId", snapshot.requestId());
        json.put("kind", snapshot.kind() == null ? JSONObject.NULL : snapshot.kind());
        json.put("state", snapshot.state().wireName());
        json.put("phase", snapshot.phase() == null ? JSONObject.NULL : snapshot.phase());
        json.put("confidence", snapshot.confidence() == null ? JSONObject.NULL : snapshot.confidence());
        json.put("message", snapshot.message());
        json.put("elapsedMs", snapshot.elapsedMs());
        json.put("completedPhases", new JSONArray(snapshot.completedPhases()));
        return json;
    }

    private static CommandSnapshot snapshotFromJson(JSONObject json) {
        List<String> completed = new ArrayList<>();
        JSONArray phases = json.optJSONArray("completedPhases");
        if (phases != null) {
            for (int i = 0; i < phases.length(); i++) {
                completed.add(phases.getString(i));
            }
        }
        return new CommandSnapshot(
                json.getString("requestId"),
                json.isNull("kind") ? null : json.optString("kind", null),
                CommandState.fromWireName(json.getString("state")),
                json.isNull("phase") ? null : json.optString("phase", null),
                json.isNull("confidence") ? null : json.getDouble("confidence"),
                json.optString("message", ""),
                json.optLong("elapsedMs", 0L),
                completed);
    }

    private static JSONObject parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty payload");
        }
        if (payload.length() > MAX_JSON_SIZE) {
            throw new IllegalArgumentException("Payload exceeds " + MAX_JSON_SIZE + " chars");
        }
        try {
            return new JSONObject(payload);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getMessage(), e);
        }
    }
}
