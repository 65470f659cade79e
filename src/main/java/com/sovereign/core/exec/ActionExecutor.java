package com.sovereign.core.exec;

import com.sovereign.core.context.ExecutionContext;

/**
 * Boundary to the outside world: performs one concrete action on behalf of a
 * task.
 */
public interface ActionExecutor {

    /**
     * Executes {@code command}.
     *
     * @param command the action, e.g. a shell command line
     * @param context context of the calling task
     * @return the action's standard output
     * @throws ActionFailedException                          the action ran and reported failure, or could not start
     * @throws com.sovereign.core.scope.CancellationSignal    the action timed out or the caller was interrupted
     */
    String execute(String command, ExecutionContext context);
}
