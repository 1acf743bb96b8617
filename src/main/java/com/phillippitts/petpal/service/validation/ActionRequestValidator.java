package com.phillippitts.petpal.service.validation;

import com.phillippitts.petpal.config.properties.ActionProperties;
import com.phillippitts.petpal.exception.InvalidCommandException;
import org.springframework.stereotype.Component;

/**
 * Validates parameters of the fire-and-forget actions before any adapter is called.
 */
@Component
public class ActionRequestValidator {

    private final ActionProperties props;

    public ActionRequestValidator(ActionProperties props) {
        this.props = props;
    }

    /**
     * Resolves and validates a dispense duration.
     *
     * @param durationMs requested duration, null for the default
     * @return duration to use
     * @throws InvalidCommandException if the duration is not in {@code 1..max-dispense-ms}
     */
    public int validateDispenseDuration(Integer durationMs) {
        int duration = durationMs == null ? props.getDefaultDispenseMs() : durationMs;
        if (duration <= 0) {
            throw new InvalidCommandException("durationMs must be positive, got: " + duration);
        }
        if (duration > props.getMaxDispenseMs()) {
            throw new InvalidCommandException("durationMs must be <= " + props.getMaxDispenseMs()
                    + ", got: " + duration);
        }
        return duration;
    }

    /**
     * Validates speech text.
     *
     * @return trimmed text
     * @throws InvalidCommandException if the text is blank or longer than {@code max-speak-length}
     */
    public String validateSpeechText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidCommandException("text must not be blank");
        }
        String trimmed = text.trim();
        if (trimmed.length() > props.getMaxSpeakLength()) {
            throw new InvalidCommandException("text must be at most " + props.getMaxSpeakLength()
                    + " characters, got: " + trimmed.length());
        }
        return trimmed;
    }
}
