package com.sovereign.dispatch.cli;

import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.engine.DeploymentOrchestrator;
import com.sovereign.core.engine.DeploymentRequest;
import com.sovereign.core.engine.EngineProperties;
import com.sovereign.core.engine.RunSummary;
import com.sovereign.core.events.EventBusCustomizer;
import com.sovereign.core.logging.SensitiveData;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: sovereign deploy --repo &lt;path&gt; --remote &lt;url&gt;
 * <p>
 * Runs the standard deployment phases and prints a run summary. Exit code is
 * 0 when the run completed, 3 when it was cancelled, 1 when it failed.
 */
@Command(name = "deploy", mixinStandardHelpOptions = true, description = "Deploy a repository to its remote")
@Component
public class DeployCommand implements Callable<Integer> {

    @Option(names = {"--repo", "-r"}, description = "Local repository path (default: configured repo-path)")
    private String repoPath;

    @Option(names = "--remote", description = "Remote URL to push to (default: configured remote-url)")
    private String remoteUrl;

    @Option(names = {"--branch", "-b"}, description = "Branch to push (default: configured branch)")
    private String branch;

    @Option(names = {"--mode", "-m"},
            description = "Execution mode: FIREFIGHTER, SURGEON, ARCHITECT, STUDENT, MANAGER")
    private String mode;

    @Option(names = "--event-log", description = "Write the run's events to this JSON-lines file")
    private String eventLog;

    @Option(names = {"--quiet", "-q"}, description = "Do not print events as they happen")
    private boolean quiet;

    private final DeploymentOrchestrator orchestrator;
    private final EngineProperties properties;

    public DeployCommand(DeploymentOrchestrator orchestrator, EngineProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionMode executionMode = properties.getMode();
        if (mode != null) {
            try {
                executionMode = ExecutionMode.valueOf(mode.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: " + Arrays.toString(ExecutionMode.values()));
                return ExitCodes.USAGE;
            }
        }

        var request = new DeploymentRequest(
                repoPath != null ? repoPath : properties.getRepoPath(),
                remoteUrl != null ? remoteUrl : properties.getRemoteUrl(),
                branch != null ? branch : properties.getBranch(),
                executionMode,
                eventLog);

        ConsoleOutput.info("Archetype: " + request.mode().displayName());
        ConsoleOutput.info("Repository: " + request.repoPath());
        if (request.remoteUrl() != null) {
            ConsoleOutput.info("Target: " + SensitiveData.mask(request.remoteUrl()) + " (" + request.branch() + ")");
        } else {
            ConsoleOutput.warn("No remote configured, the push phase is skipped");
        }

        EventBusCustomizer progress = quiet ? null : bus -> bus.subscribeAll((event, context) -> ConsoleOutput.event(event));
        RunSummary summary = orchestrator.deploy(request, progress);
        ConsoleOutput.runSummary(summary);
        return ExitCodes.of(summary.status());
    }
}
