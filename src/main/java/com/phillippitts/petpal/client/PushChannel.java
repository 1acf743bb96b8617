package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.Notification;

import java.io.IOException;

/**
 * Server-initiated notification stream.
 */
public interface PushChannel {

    /**
     * Opens the stream. Returns once the server has accepted it; notifications then arrive on the
     * channel's own thread.
     *
     * @throws IOException if the stream cannot be opened or push is not supported by the server
     */
    Connection open(Listener listener) throws IOException;

    /**
     * Callbacks of an open stream.
     */
    interface Listener {

        void onNotification(Notification notification);

        /**
         * The stream ended. Not called after {@link Connection#close()}.
         *
         * @param cause failure, or {@code null} if the server closed the stream
         */
        void onDisconnected(Throwable cause);
    }

    /**
     * Handle of an open stream.
     */
    interface Connection extends AutoCloseable {

        @Override
        void close();
    }
}
