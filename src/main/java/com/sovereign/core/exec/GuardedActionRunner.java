package com.sovereign.core.exec;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.gateway.Decision;
import com.sovereign.core.gateway.ValidationGateway;
import com.sovereign.core.logging.SensitiveData;
import com.sovereign.core.metrics.SovereignMetrics;
import com.sovereign.core.scope.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validate-then-act: every action a task performs goes through the
 * {@link ValidationGateway} before it reaches the {@link ActionExecutor}.
 * <p>
 * A self-preservation veto becomes a {@link CancellationSignal}, which the
 * enclosing scope treats as cancellation rather than failure. Any other
 * rejection becomes an {@link ActionRejectedException}.
 */
@Service
public class GuardedActionRunner {

    private static final Logger log = LoggerFactory.getLogger(GuardedActionRunner.class);

    private final ValidationGateway gateway;
    private final ActionExecutor executor;
    private final SovereignMetrics metrics;

    public GuardedActionRunner(ValidationGateway gateway, ActionExecutor executor, SovereignMetrics metrics) {
        this.gateway = gateway;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Validates and, when allowed, executes {@code action}.
     *
     * @param eventBus bus of the current run
     * @param context  context of the calling task
     * @param action   the command to run
     * @param intent   why it runs; checked for manipulation markers
     * @return the action's output
     */
    public String run(EventBus eventBus, ExecutionContext context, String action, String intent) {
        Decision decision = gateway.validate(action, intent, context);
        metrics.recordValidation(decision);
        String masked = SensitiveData.mask(action);

        if (!decision.isAllowed()) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("action", masked);
            payload.put("category", decision.category().name());
            payload.put("reason", decision.reason());
            eventBus.emit(EventTypes.ACTION_REJECTED, payload, context);
            if (decision.isSelfPreservationVeto()) {
                log.warn("Action vetoed, cancelling [span: {}]: {}", context.spanId(), decision.reason());
                throw new CancellationSignal(CancellationSignal.Reason.SELF_PRESERVATION,
                        "Action rejected: " + decision.reason());
            }
            throw new ActionRejectedException(decision.category(), "Action rejected: " + decision.reason());
        }

        if (decision.hasWarnings()) {
            eventBus.emit(EventTypes.ACTION_WARNING,
                    Map.of("action", masked, "warnings", decision.warnings()), context);
        }
        eventBus.emit(EventTypes.ACTION_VALIDATED, Map.of("action", masked, "intent", intent == null ? "" : intent), context);
        return executor.execute(action, context);
    }
}
