package com.phillippitts.petpal.domain;

import java.util.Objects;

/**
 * Command state transition, carrying exactly the fields the status endpoint returns.
 *
 * @param snapshot command snapshot taken right after the transition
 */
public record StatusNotification(CommandSnapshot snapshot) implements Notification {

    public StatusNotification {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    @Override
    public Type type() {
        return Type.STATUS;
    }

    @Override
    public String requestId() {
        return snapshot.requestId();
    }
}
