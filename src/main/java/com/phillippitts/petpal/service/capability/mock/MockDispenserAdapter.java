package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.service.capability.DispenserAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated treat dispenser; records calls instead of driving a motor.
 */
public class MockDispenserAdapter implements DispenserAdapter {

    private static final Logger LOG = LogManager.getLogger(MockDispenserAdapter.class);

    private final AtomicInteger dispensed = new AtomicInteger();

    @Override
    public void dispense(int durationMs) {
        int count = dispensed.incrementAndGet();
        LOG.info("Mock dispenser ran for {}ms (total={})", durationMs, count);
    }

    public int getDispensedCount() {
        return dispensed.get();
    }
}
