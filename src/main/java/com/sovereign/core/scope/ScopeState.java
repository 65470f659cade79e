package com.sovereign.core.scope;

/**
 * Lifecycle state of a {@link TaskScope}.
 */
public enum ScopeState {
    OPEN,       // accepting spawns
    DRAINING,   // exit started, waiting for children
    CLOSED
}
