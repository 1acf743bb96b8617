package com.phillippitts.petpal.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the broadcast hub, the SSE push channel and the optional shared
 * pub/sub bus used in multi-instance deployments.
 */
@Validated
@ConfigurationProperties(prefix = "petpal.broadcast")
public class BroadcastProperties {

    /** Pending notifications per subscriber before it is considered unreachable and pruned. */
    @Positive
    private int subscriberQueueCapacity = 256;

    /** SSE emitter timeout in milliseconds; 0 keeps the stream open indefinitely. */
    @Min(0)
    private long sseTimeoutMs = 0;

    @Valid
    private Bus bus = new Bus();

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public long getSseTimeoutMs() {
        return sseTimeoutMs;
    }

    public void setSseTimeoutMs(long sseTimeoutMs) {
        this.sseTimeoutMs = sseTimeoutMs;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    /**
     * Shared bus (Redis pub/sub) settings.
     */
    public static class Bus {

        /** Mirror notifications through Redis so sibling instances' subscribers receive them. */
        private boolean enabled = false;

        @NotBlank
        private String channel = "petpal:notifications";

        /** Identifies this instance on the bus; generated when blank. */
        private String instanceId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public String getInstanceId() {
            return instanceId;
        }

        public void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }
    }
}
