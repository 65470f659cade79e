package com.sovereign.core.scope;

/**
 * Cooperative stop request. Not an error: a scope absorbs it and returns
 * normally with its cancelled flag set.
 */
public class CancellationSignal extends RuntimeException {

    /**
     * What triggered the cancellation.
     */
    public enum Reason {
        /** The validation gateway vetoed an action. */
        SELF_PRESERVATION,
        /** An action or scope exceeded its time budget. */
        TIMEOUT,
        /** Requested from outside the scope, e.g. an interrupt. */
        EXTERNAL,
        /** A sibling task failed and the scope is failing fast. */
        SIBLING_FAILURE
    }

    private final Reason reason;

    public CancellationSignal(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CancellationSignal(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
