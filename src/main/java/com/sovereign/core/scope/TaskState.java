package com.sovereign.core.scope;

/**
 * Lifecycle state of a {@link TaskHandle}. A handle leaves {@link #RUNNING}
 * exactly once.
 */
public enum TaskState {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
