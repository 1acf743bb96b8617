package com.phillippitts.petpal.exception;

/**
 * Thrown when a request is malformed: an unknown command prompt or an action parameter
 * outside its bounds. Not retryable.
 */
public class InvalidCommandException extends PetPalException {

    private final String reason;

    public InvalidCommandException(String reason) {
        super("Invalid request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
