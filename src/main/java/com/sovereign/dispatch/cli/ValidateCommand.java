package com.sovereign.dispatch.cli;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.gateway.Decision;
import com.sovereign.core.gateway.ValidationGateway;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: sovereign validate "&lt;action&gt;"
 * <p>
 * Shows the gateway decision for an action without running it. Exit code is 0
 * when allowed and 3 when vetoed.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check an action against the validation gateway")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Action to check, e.g. a shell command")
    private String action;

    @Option(names = {"--intent", "-i"}, description = "Why the action would run", defaultValue = "")
    private String intent;

    private final ValidationGateway gateway;

    public ValidateCommand(ValidationGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Integer call() {
        var context = ExecutionContext.root(ExecutionContext.newTraceId("validate"), ExecutionMode.SURGEON, Map.of());
        Decision decision = gateway.validate(action, intent, context);
        ConsoleOutput.decision(action, decision);
        return decision.isAllowed() ? ExitCodes.OK : ExitCodes.CANCELLED;
    }
}
