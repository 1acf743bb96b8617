package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import java.nio.charset.StandardCharsets;

/**
 * Inbound half of the shared bus: decodes envelopes from sibling instances and delivers them to
 * local subscribers. Envelopes published by this instance are dropped.
 */
public final class SharedBusListener implements MessageListener {

    private static final Logger LOG = LogManager.getLogger(SharedBusListener.class);

    private final BroadcastHub hub;
    private final NotificationCodec codec;
    private final String instanceId;

    public SharedBusListener(BroadcastHub hub, NotificationCodec codec, String instanceId) {
        this.hub = hub;
        this.codec = codec;
        this.instanceId = instanceId;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        handle(new String(message.getBody(), StandardCharsets.UTF_8));
    }

    void handle(String payload) {
        try {
            JSONObject envelope = new JSONObject(payload);
            if (instanceId.equals(envelope.optString(RedisSharedBus.ORIGIN, null))) {
                return;
            }
            Notification notification = codec.decode(envelope.getJSONObject(RedisSharedBus.NOTIFICATION).toString());
            hub.deliverFromBus(notification);
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Dropping malformed bus message: {}", e.getMessage());
        }
    }
}
