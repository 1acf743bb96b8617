package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.StatusNotification;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.metrics.CommandMetrics;

/**
 * Hands every command record mutation to the broadcast hub and records terminal outcomes.
 */
public final class CommandStatusPublisher implements CommandStatusListener {

    private final BroadcastHub hub;
    private final CommandMetrics metrics;

    /**
     * @param hub     broadcast hub
     * @param metrics metrics (nullable for tests)
     */
    public CommandStatusPublisher(BroadcastHub hub, CommandMetrics metrics) {
        this.hub = hub;
        this.metrics = metrics;
    }

    @Override
    public void onTransition(CommandSnapshot snapshot) {
        hub.publish(new StatusNotification(snapshot));
        if (metrics != null) {
            metrics.recordOutcome(snapshot);
        }
    }
}
