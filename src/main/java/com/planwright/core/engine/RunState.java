package com.planwright.core.engine;

/**
 * Lifecycle of an orchestration run.
 * <pre>
 * RUNNING -> PAUSING -> PAUSED -> RUNNING
 * RUNNING | PAUSING | PAUSED -> CANCELLING -> STOPPED
 * RUNNING -> STOPPED
 * </pre>
 */
public enum RunState {
    RUNNING,
    PAUSING,     // no new dispatch; waiting for in-flight tasks
    PAUSED,
    CANCELLING,  // no new dispatch; run ends once in-flight tasks return
    STOPPED;

    public boolean isActive() {
        return this != STOPPED;
    }
}
