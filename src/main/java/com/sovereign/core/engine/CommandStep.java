package com.sovereign.core.engine;

import java.util.Objects;

/**
 * One command of a {@link CommandPhase}.
 *
 * @param name            task name, unique within the phase
 * @param command         shell command line
 * @param intent          why the command runs, passed to the gateway
 * @param tolerateFailure when true a failing command is logged and the task still completes
 */
public record CommandStep(String name, String command, String intent, boolean tolerateFailure) {

    public CommandStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
    }

    public static CommandStep of(String name, String command, String intent) {
        return new CommandStep(name, command, intent, false);
    }

    public static CommandStep tolerant(String name, String command, String intent) {
        return new CommandStep(name, command, intent, true);
    }
}
