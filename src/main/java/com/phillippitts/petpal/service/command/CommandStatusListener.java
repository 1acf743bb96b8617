package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandSnapshot;

/**
 * Receives every command record mutation, in mutation order.
 *
 * <p>Called while the state machine holds its lock, so implementations must not block: enqueue and
 * return.
 */
@FunctionalInterface
public interface CommandStatusListener {

    CommandStatusListener NOOP = snapshot -> { };

    void onTransition(CommandSnapshot snapshot);
}
