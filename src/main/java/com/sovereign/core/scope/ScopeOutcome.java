package com.sovereign.core.scope;

/**
 * Result of a scope exit that did not fail.
 *
 * @param scope          scope name
 * @param traceId        trace of the scope
 * @param spanId         span of the scope
 * @param cancelled      true when a cancellation signal terminated the scope
 * @param reason         reason of that signal, null when not cancelled
 * @param message        message of that signal, null when not cancelled
 * @param completed      children that completed
 * @param cancelledTasks children that were cancelled
 */
public record ScopeOutcome(
    String scope,
    String traceId,
    String spanId,
    boolean cancelled,
    CancellationSignal.Reason reason,
    String message,
    int completed,
    int cancelledTasks
) {

    public int taskCount() {
        return completed + cancelledTasks;
    }
}
