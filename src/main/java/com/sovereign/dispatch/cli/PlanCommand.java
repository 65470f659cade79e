package com.sovereign.dispatch.cli;

import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.events.EventBusCustomizer;
import com.sovereign.core.planner.PlanReport;
import com.sovereign.core.planner.RecursivePlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: sovereign plan "&lt;goal&gt;"
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Decompose a goal and execute its subtasks")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Goal to plan and execute")
    private String goal;

    @Option(names = {"--mode", "-m"},
            description = "Execution mode: FIREFIGHTER, SURGEON, ARCHITECT, STUDENT, MANAGER",
            defaultValue = "STUDENT")
    private String mode;

    @Option(names = {"--quiet", "-q"}, description = "Do not print events as they happen")
    private boolean quiet;

    private final RecursivePlanner planner;

    public PlanCommand(RecursivePlanner planner) {
        this.planner = planner;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionMode executionMode;
        try {
            executionMode = ExecutionMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: " + Arrays.toString(ExecutionMode.values()));
            return ExitCodes.USAGE;
        }
        if (goal.isBlank()) {
            ConsoleOutput.error("Goal must not be blank");
            return ExitCodes.USAGE;
        }

        ConsoleOutput.info("Planning: " + goal);
        EventBusCustomizer progress = quiet ? null : bus -> bus.subscribeAll((event, context) -> ConsoleOutput.event(event));
        PlanReport report = planner.plan(goal, executionMode, progress);
        ConsoleOutput.planReport(report);
        return ExitCodes.of(report.status());
    }
}
