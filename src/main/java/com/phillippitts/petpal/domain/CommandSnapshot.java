package com.phillippitts.petpal.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Immutable point-in-time view of a command record.
 *
 * <p>The same value is returned by the status endpoint and carried by every push notification, so a
 * consumer can switch between push and pull without noticing.
 *
 * @param requestId       unique request identifier
 * @param kind            whitelisted prompt of the command
 * @param state           lifecycle state
 * @param phase           current (or last entered) phase wire name, nullable
 * @param confidence      confidence of the most recent detection attempt in [0,1], nullable
 * @param message         human-readable message (never null)
 * @param elapsedMs       elapsed time since acceptance; frozen once terminal
 * @param completedPhases phases completed so far, in order
 */
public record CommandSnapshot(
        String requestId,
        String kind,
        CommandState state,
        String phase,
        Double confidence,
        String message,
        long elapsedMs,
        List<String> completedPhases
) {

    public CommandSnapshot {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        message = message == null ? "" : message;
        completedPhases = completedPhases == null ? List.of() : List.copyOf(completedPhases);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
