package com.sovereign.core.scope;

/**
 * A scope body threw a checked exception; rethrown from {@link TaskScope#exit}
 * after all children have terminated.
 */
public class ScopeFailedException extends RuntimeException {

    public ScopeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
