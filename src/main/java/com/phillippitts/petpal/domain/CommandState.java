package com.phillippitts.petpal.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Lifecycle state of a command record.
 *
 * <p>{@code idle} is not a per-record state: it is the orchestrator's readiness to accept a new
 * command and is reported only by {@code CommandStateMachine#isIdle()}.
 *
 * <pre>
 * EXECUTING → COMPLETED | FAILED | TIMEOUT | INTERRUPTED
 * </pre>
 */
public enum CommandState {

    EXECUTING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    INTERRUPTED;

    /** Lower-case name used on the wire (status endpoint and push channel). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != EXECUTING;
    }

    /**
     * Parses a wire name back to a state.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static CommandState fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(s -> s.wireName().equalsIgnoreCase(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown command state: " + wireName));
    }
}
