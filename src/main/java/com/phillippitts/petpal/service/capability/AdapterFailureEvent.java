package com.phillippitts.petpal.service.capability;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a capability adapter call raises or exceeds its bound.
 *
 * <p>Do not include user-supplied text (speech) in context. Restrict to technical diagnostics.
 */
public record AdapterFailureEvent(
        String capability,
        String operation,
        Instant at,
        String message,
        Map<String, String> context
) {
    public AdapterFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
