package com.sovereign.core.engine;

import com.sovereign.core.scope.TaskScope;

/**
 * One named step of a run. The orchestrator opens a {@link TaskScope} named
 * after the phase and hands it to {@link #execute}; everything the phase
 * spawns belongs to that scope.
 */
public interface Phase {

    String name();

    void execute(TaskScope scope, PhaseRuntime runtime) throws Exception;
}
