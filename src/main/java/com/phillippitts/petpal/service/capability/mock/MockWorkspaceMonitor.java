package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.service.capability.WorkspaceMonitor;

/**
 * Simulated workspace monitor with a fixed answer.
 */
public class MockWorkspaceMonitor implements WorkspaceMonitor {

    private final boolean clear;

    public MockWorkspaceMonitor(boolean clear) {
        this.clear = clear;
    }

    @Override
    public boolean isClear() {
        return clear;
    }
}
