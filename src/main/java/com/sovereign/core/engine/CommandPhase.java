package com.sovereign.core.engine;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.exec.ActionFailedException;
import com.sovereign.core.scope.TaskHandle;
import com.sovereign.core.scope.TaskScope;
import com.sovereign.core.scope.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Phase made of shell commands, each run as its own task through the
 * {@link com.sovereign.core.exec.GuardedActionRunner}.
 * <p>
 * Steps run in order: the next step is spawned only after the previous one
 * completed, and the phase stops spawning once a step ends any other way.
 */
public class CommandPhase implements Phase {

    private static final Logger log = LoggerFactory.getLogger(CommandPhase.class);

    private final String name;
    private final List<CommandStep> steps;

    public CommandPhase(String name, List<CommandStep> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public static CommandPhase ordered(String name, CommandStep... steps) {
        return new CommandPhase(name, List.of(steps));
    }

    @Override
    public String name() {
        return name;
    }

    public List<CommandStep> steps() {
        return steps;
    }

    @Override
    public void execute(TaskScope scope, PhaseRuntime runtime) throws InterruptedException {
        for (CommandStep step : steps) {
            TaskHandle handle = scope.spawn(step.name(), context -> runStep(step, runtime, context));
            if (scope.join(handle) != TaskState.COMPLETED) {
                Throwable failure = handle.failure();
                log.info("Phase '{}' stops after step '{}' ended {}{}", name, step.name(), handle.state(),
                        failure != null ? ": " + failure.getMessage() : "");
                return;
            }
        }
    }

    private static void runStep(CommandStep step, PhaseRuntime runtime, ExecutionContext context) {
        try {
            String output = runtime.runner().run(runtime.eventBus(), context, step.command(), step.intent());
            if (output != null && !output.isBlank()) {
                log.debug("{}: {}", step.name(), output.strip());
            }
        } catch (ActionFailedException e) {
            if (!step.tolerateFailure()) {
                throw e;
            }
            log.warn("Step '{}' failed, continuing: {}", step.name(), e.getMessage());
        }
    }
}
