package com.sovereign.core.scope;

import com.sovereign.core.context.ExecutionContext;

/**
 * Body of a spawned task. Receives the task's own child context.
 * <p>
 * Return normally on success, throw {@link CancellationSignal} to stop
 * cooperatively, or throw anything else to fail. Cancellation requests arrive
 * as a thread interrupt.
 */
@FunctionalInterface
public interface ScopeTask {

    void run(ExecutionContext context) throws Exception;
}
