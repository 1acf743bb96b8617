package com.phillippitts.petpal.client;

/**
 * Connection state of a {@link StatusSubscriber}.
 *
 * <p>{@code DISCONNECTED → CONNECTING → CONNECTED_PUSH | CONNECTED_POLL}. {@code CONNECTED_POLL} is
 * final for the session.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED_PUSH,
    CONNECTED_POLL
}
