package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;

/**
 * Outbound half of the multi-instance fan-out. Inbound messages are delivered to
 * {@link BroadcastHub#deliverFromBus} by the bus listener and are never handed back here.
 */
public interface SharedBus {

    /**
     * Mirrors a locally published notification to sibling instances. Must not block and must not
     * throw; failures switch the bus to degraded mode.
     */
    void publish(Notification notification);

    boolean isEnabled();

    /**
     * {@code false} while the last publish attempt failed.
     */
    boolean isAvailable();
}
