package com.sovereign.dispatch.cli;

import com.sovereign.core.gateway.GatewayProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: sovereign invariants
 * <p>
 * Prints the rules the validation gateway enforces: the self-preservation
 * patterns that veto, the manipulation markers that warn, and the complexity
 * threshold.
 */
@Command(name = "invariants", mixinStandardHelpOptions = true, description = "Show the invariants the validation gateway enforces")
@Component
public class InvariantsCommand implements Callable<Integer> {

    private final GatewayProperties gatewayProperties;

    public InvariantsCommand(GatewayProperties gatewayProperties) {
        this.gatewayProperties = gatewayProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.invariants(gatewayProperties);
        return ExitCodes.OK;
    }
}
