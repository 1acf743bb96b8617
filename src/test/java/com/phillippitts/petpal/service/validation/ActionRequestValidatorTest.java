package com.phillippitts.petpal.service.validation;

import com.phillippitts.petpal.config.properties.ActionProperties;
import com.phillippitts.petpal.exception.InvalidCommandException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRequestValidatorTest {

    private final ActionRequestValidator validator = new ActionRequestValidator(ActionProperties.defaults());

    @Test
    void shouldUseDefaultDurationWhenMissing() {
        assertThat(validator.validateDispenseDuration(null)).isEqualTo(600);
    }

    @Test
    void shouldAcceptDurationAtUpperBound() {
        assertThat(validator.validateDispenseDuration(5_000)).isEqualTo(5_000);
    }

    @Test
    void shouldRejectDurationAboveMaximum() {
        assertThatThrownBy(() -> validator.validateDispenseDuration(5_001))
                .isInstanceOf(InvalidCommandException.class)
                .hasMessageContaining("durationMs must be <= 5000");
    }

    @Test
    void shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> validator.validateDispenseDuration(-1))
                .isInstanceOf(InvalidCommandException.class)
                .hasMessageContaining("durationMs must be positive");
    }

    @Test
    void shouldTrimSpeechText() {
        assertThat(validator.validateSpeechText("  sit  ")).isEqualTo("sit");
    }

    @Test
    void shouldRejectNullOrBlankSpeech() {
        assertThatThrownBy(() -> validator.validateSpeechText(null)).isInstanceOf(InvalidCommandException.class);
        assertThatThrownBy(() -> validator.validateSpeechText(" \t")).isInstanceOf(InvalidCommandException.class);
    }

    @Test
    void shouldRejectSpeechLongerThanLimit() {
        assertThatThrownBy(() -> validator.validateSpeechText("x".repeat(201)))
                .isInstanceOf(InvalidCommandException.class)
                .hasMessageContaining("at most 200 characters");
    }
}
