package com.sovereign.core.engine;

/**
 * Terminal status of a run or of one phase.
 */
public enum RunStatus {
    COMPLETED,
    CANCELLED,
    FAILED
}
