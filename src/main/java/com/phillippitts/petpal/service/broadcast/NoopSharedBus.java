package com.phillippitts.petpal.service.broadcast;

import com.phillippitts.petpal.domain.Notification;

/**
 * Single-instance deployment: nothing to mirror.
 */
public final class NoopSharedBus implements SharedBus {

    public static final NoopSharedBus INSTANCE = new NoopSharedBus();

    private NoopSharedBus() {
    }

    @Override
    public void publish(Notification notification) {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
