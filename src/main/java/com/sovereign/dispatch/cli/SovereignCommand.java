package com.sovereign.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Sovereign.
 * Routes to subcommands: deploy, plan, validate, invariants.
 */
@Command(
        name = "sovereign",
        mixinStandardHelpOptions = true,
        version = "Sovereign 0.1.0",
        description = "Deployment orchestration with structured concurrency and pre-execution validation",
        subcommands = {
                DeployCommand.class,
                PlanCommand.class,
                ValidateCommand.class,
                InvariantsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SovereignCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
