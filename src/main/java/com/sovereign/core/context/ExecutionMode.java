package com.sovereign.core.context;

import java.util.Locale;

/**
 * Execution mode a run is carried out in. Propagated unchanged from the root
 * context to every descendant.
 */
public enum ExecutionMode {
    FIREFIGHTER,    // emergency, maximum speed
    SURGEON,        // precise, minimal changes
    ARCHITECT,      // systematic, complete
    STUDENT,        // exploratory
    MANAGER;        // high-level, decision points

    /**
     * Capitalized name, e.g. {@code Architect}.
     */
    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
