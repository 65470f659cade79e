package com.sovereign.core.scope;

import com.sovereign.core.context.ExecutionContext;

/**
 * A task body failed with something other than a cancellation. Carries the
 * task name and context so the failure can be located in the causal tree.
 */
public class TaskFailedException extends RuntimeException {

    private final String taskName;
    private final transient ExecutionContext context;

    public TaskFailedException(String taskName, ExecutionContext context, Throwable cause) {
        super("Task '" + taskName + "' failed [span: " + context.spanId() + "]: " + describe(cause), cause);
        this.taskName = taskName;
        this.context = context;
    }

    public String taskName() {
        return taskName;
    }

    public ExecutionContext context() {
        return context;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
