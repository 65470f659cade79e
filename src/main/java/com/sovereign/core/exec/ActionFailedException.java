package com.sovereign.core.exec;

/**
 * An action finished unsuccessfully or could not be started.
 */
public class ActionFailedException extends RuntimeException {

    /** Exit code used when the process never started. */
    public static final int NOT_STARTED = -1;

    private final int exitCode;
    private final String stderr;

    public ActionFailedException(String message, int exitCode, String stderr) {
        super(message);
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public ActionFailedException(String message, int exitCode, String stderr, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }
}
