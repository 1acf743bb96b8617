package com.phillippitts.petpal.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the fire-and-forget actions (treat dispenser, speech).
 */
@Validated
@ConfigurationProperties(prefix = "petpal.actions")
public class ActionProperties {

    @Positive
    private final int maxDispenseMs;

    @Positive
    private final int defaultDispenseMs;

    @Positive
    private final int maxSpeakLength;

    /** Upper bound for a single dispenser or speaker call. */
    @Positive
    private final long callTimeoutMs;

    @ConstructorBinding
    public ActionProperties(Integer maxDispenseMs, Integer defaultDispenseMs,
                            Integer maxSpeakLength, Long callTimeoutMs) {
        this.maxDispenseMs = maxDispenseMs == null ? 5000 : maxDispenseMs;
        this.defaultDispenseMs = defaultDispenseMs == null ? 600 : defaultDispenseMs;
        this.maxSpeakLength = maxSpeakLength == null ? 200 : maxSpeakLength;
        this.callTimeoutMs = callTimeoutMs == null ? 10_000L : callTimeoutMs;
    }

    /**
     * Defaults for tests.
     */
    public static ActionProperties defaults() {
        return new ActionProperties(null, null, null, null);
    }

    public int getMaxDispenseMs() {
        return maxDispenseMs;
    }

    public int getDefaultDispenseMs() {
        return defaultDispenseMs;
    }

    public int getMaxSpeakLength() {
        return maxSpeakLength;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }
}
