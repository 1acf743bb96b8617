package com.phillippitts.petpal.service.health;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.broadcast.SharedBus;
import com.phillippitts.petpal.service.command.CommandService;
import com.phillippitts.petpal.service.events.EventBuffer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Optional;

/**
 * Health indicator for command orchestration and notification fan-out.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: orchestrator ready; shared bus disabled or reachable</li>
 *   <li>DEGRADED: shared bus enabled but unreachable (local-only broadcast)</li>
 * </ul>
 *
 * <p>Details include the active request, subscriber count and event buffer depth. Exposed via
 * /actuator/health endpoint.
 */
public class CommandOrchestratorHealthIndicator implements HealthIndicator {

    private final CommandService commandService;
    private final BroadcastHub hub;
    private final EventBuffer eventBuffer;

    public CommandOrchestratorHealthIndicator(CommandService commandService, BroadcastHub hub,
                                              EventBuffer eventBuffer) {
        this.commandService = commandService;
        this.hub = hub;
        this.eventBuffer = eventBuffer;
    }

    @Override
    public Health health() {
        SharedBus bus = hub.getBus();
        Health.Builder builder = new Health.Builder();

        if (bus.isEnabled() && !bus.isAvailable()) {
            builder.status("DEGRADED").withDetail("status", "Shared bus unavailable; broadcasting locally only");
        } else {
            builder.up().withDetail("status", "Orchestrator ready");
        }

        Optional<CommandSnapshot> active = commandService.activeCommand();
        builder.withDetail("activeRequestId", active.map(CommandSnapshot::requestId).orElse("none"))
                .withDetail("subscribers", hub.subscriberCount())
                .withDetail("bus", busStatus(bus))
                .withDetail("bufferedEvents", eventBuffer.size());
        return builder.build();
    }

    private String busStatus(SharedBus bus) {
        if (!bus.isEnabled()) {
            return "disabled";
        }
        return bus.isAvailable() ? "ready" : "unavailable";
    }
}
