package com.sovereign.dispatch.cli;

import com.sovereign.core.engine.RunStatus;

/**
 * Process exit codes of the CLI.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;
    public static final int CANCELLED = 3;

    private ExitCodes() {}

    public static int of(RunStatus status) {
        return switch (status) {
            case COMPLETED -> OK;
            case CANCELLED -> CANCELLED;
            case FAILED -> FAILED;
        };
    }
}
