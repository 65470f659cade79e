package com.sovereign.core.planner;

import com.sovereign.core.context.ExecutionMode;

/**
 * One unit of a decomposed goal.
 *
 * @param name       what to do; also the validated action
 * @param complexity estimated complexity in {@code [0, 1]}
 * @param mode       execution mode the subtask is approached with
 */
public record Subtask(String name, double complexity, ExecutionMode mode) {

    public Subtask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("subtask name must not be blank");
        }
        if (complexity < 0.0 || complexity > 1.0) {
            throw new IllegalArgumentException("complexity must be within [0, 1]: " + complexity);
        }
    }

    /**
     * Intent presented to the gateway together with {@link #name()}.
     */
    public String intent() {
        return "Execute " + name + " as " + mode.displayName();
    }
}
