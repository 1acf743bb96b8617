package com.phillippitts.petpal.exception;

/**
 * Thrown when a capability adapter call (arm, detector, dispenser, speaker) raises.
 * Inside a command this becomes a {@code failed} outcome carrying the adapter detail;
 * for direct actions it is surfaced to the caller.
 */
public class AdapterFailureException extends PetPalException {

    private final String capability;

    public AdapterFailureException(String capability, String message) {
        super(message + " (capability: " + capability + ")");
        this.capability = capability;
    }

    public AdapterFailureException(String capability, String message, Throwable cause) {
        super(message + " (capability: " + capability + ")", cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
