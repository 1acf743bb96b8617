package com.phillippitts.petpal.service.capability;

/**
 * Treat dispenser.
 */
public interface DispenserAdapter {

    /**
     * Runs the dispenser motor for the given duration.
     */
    void dispense(int durationMs);
}
