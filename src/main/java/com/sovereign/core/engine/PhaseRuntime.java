package com.sovereign.core.engine;

import com.sovereign.core.events.EventBus;
import com.sovereign.core.exec.GuardedActionRunner;

/**
 * What a phase body needs from the running orchestrator.
 *
 * @param eventBus bus of the current run
 * @param runner   validate-then-act entry point for the phase's actions
 */
public record PhaseRuntime(EventBus eventBus, GuardedActionRunner runner) {}
