package com.phillippitts.petpal.service.capability;

import com.phillippitts.petpal.config.properties.ActionProperties;
import com.phillippitts.petpal.service.validation.ActionRequestValidator;
import com.phillippitts.petpal.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fire-and-forget capability actions outside the command state machine: dispensing a treat and
 * speaking through the robot's speaker. Parameters are validated before the adapter is called, and
 * each call is bounded by {@code petpal.actions.call-timeout-ms}.
 */
public final class DirectActionService {

    private static final Logger LOG = LogManager.getLogger(DirectActionService.class);
    private static final int MAX_LOGGED_TEXT = 40;

    private final DispenserAdapter dispenser;
    private final SpeechAdapter speech;
    private final CapabilityInvoker invoker;
    private final ActionRequestValidator validator;
    private final ActionProperties properties;

    public DirectActionService(DispenserAdapter dispenser,
                               SpeechAdapter speech,
                               CapabilityInvoker invoker,
                               ActionRequestValidator validator,
                               ActionProperties properties) {
        this.dispenser = dispenser;
        this.speech = speech;
        this.invoker = invoker;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * @return the duration actually used
     */
    public int dispenseTreat(Integer durationMs) {
        int duration = validator.validateDispenseDuration(durationMs);
        invoker.run("dispenser", "dispense", properties.getCallTimeoutMs(), () -> dispenser.dispense(duration));
        LOG.info("Dispensed treat for {}ms", duration);
        return duration;
    }

    public void speak(String text) {
        String validated = validator.validateSpeechText(text);
        invoker.run("speaker", "speak", properties.getCallTimeoutMs(), () -> speech.speak(validated));
        LOG.info("Spoke: '{}'", LogSanitizer.truncate(validated, MAX_LOGGED_TEXT));
    }
}
