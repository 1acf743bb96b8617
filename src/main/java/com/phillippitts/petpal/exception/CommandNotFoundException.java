package com.phillippitts.petpal.exception;

/**
 * Thrown when a status lookup names a request identifier that is unknown or has been
 * evicted from the retention window.
 */
public class CommandNotFoundException extends PetPalException {

    private final String requestId;

    public CommandNotFoundException(String requestId) {
        super("Unknown request id: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
