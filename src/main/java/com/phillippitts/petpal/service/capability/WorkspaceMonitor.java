package com.phillippitts.petpal.service.capability;

/**
 * Reports whether the arm's reach is free of people and animals. Consulted before the throw.
 */
public interface WorkspaceMonitor {

    boolean isClear();
}
