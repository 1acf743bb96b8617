package com.phillippitts.petpal.exception;

/**
 * Thrown when a non-preemptive command is submitted while another command is executing.
 * Recoverable: callers retry with backoff or issue the preemptive command.
 */
public class BusyException extends PetPalException {

    private final String activeRequestId;

    public BusyException(String activeRequestId) {
        super("Another command is in progress (active=" + activeRequestId + ")");
        this.activeRequestId = activeRequestId;
    }

    public String getActiveRequestId() {
        return activeRequestId;
    }
}
