package com.phillippitts.petpal.exception;

/**
 * Thrown when a capability adapter call does not return within its bound. The call is
 * cancelled; whether the adapter honours cancellation is up to the adapter.
 */
public class CapabilityTimeoutException extends AdapterFailureException {

    private final long timeoutMs;

    public CapabilityTimeoutException(String capability, String operation, long timeoutMs) {
        super(capability, operation + " did not return within " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
