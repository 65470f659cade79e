package com.sovereign.core.planner;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.engine.RunStatus;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventBusCustomizer;
import com.sovereign.core.events.EventProperties;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.gateway.Decision;
import com.sovereign.core.gateway.ValidationGateway;
import com.sovereign.core.logging.MdcContext;
import com.sovereign.core.metrics.SovereignMetrics;
import com.sovereign.core.scope.CancellationSignal;
import com.sovereign.core.scope.ScopeOutcome;
import com.sovereign.core.scope.TaskHandle;
import com.sovereign.core.scope.TaskScope;
import com.sovereign.core.scope.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Decomposes a goal into subtasks and carries them out one after another in a
 * {@code plan} scope, validating each before it runs.
 * <p>
 * Each subtask is checked by the {@link ValidationGateway} with its name as the
 * action. A self-preservation veto cancels the rest of the plan; any other
 * rejection is recorded and the plan moves on. Allowed subtasks run through
 * the {@link SubtaskHandler} and their results go to the {@link PlanResultStore}.
 */
@Service
public class RecursivePlanner {

    private static final Logger log = LoggerFactory.getLogger(RecursivePlanner.class);

    static final String TRACE_PREFIX = "plan";
    static final String SCOPE_NAME = "plan";

    private final ValidationGateway gateway;
    private final SubtaskHandler handler;
    private final PlanResultStore store;
    private final ExecutorService taskExecutor;
    private final EventProperties eventProperties;
    private final List<EventBusCustomizer> customizers;
    private final SovereignMetrics metrics;

    public RecursivePlanner(ValidationGateway gateway, SubtaskHandler handler, PlanResultStore store,
                            ExecutorService taskExecutor, EventProperties eventProperties,
                            List<EventBusCustomizer> customizers, SovereignMetrics metrics) {
        this.gateway = gateway;
        this.handler = handler;
        this.store = store;
        this.taskExecutor = taskExecutor;
        this.eventProperties = eventProperties;
        this.customizers = List.copyOf(customizers);
        this.metrics = metrics;
    }

    /**
     * Splits a goal into subtasks. Goals about building something get the
     * four-step learn/design/implement/verify decomposition; anything else is
     * a single exploratory subtask.
     */
    public List<Subtask> decompose(String goal) {
        if (goal.toLowerCase(Locale.ROOT).contains("build")) {
            return List.of(
                    new Subtask("analyze_requirements", 0.3, ExecutionMode.STUDENT),
                    new Subtask("design_architecture", 0.6, ExecutionMode.ARCHITECT),
                    new Subtask("implement_core", 0.8, ExecutionMode.SURGEON),
                    new Subtask("test_and_verify", 0.5, ExecutionMode.FIREFIGHTER));
        }
        return List.of(new Subtask(goal, 0.4, ExecutionMode.STUDENT));
    }

    public PlanReport plan(String goal, ExecutionMode mode) {
        return plan(goal, mode, null);
    }

    /**
     * Plans and executes {@code goal}.
     *
     * @param goal  what to achieve
     * @param mode  mode of the plan's root context
     * @param extra additional bus customizer for this run only, may be null
     * @return the plan report; never throws for subtask failures
     */
    public PlanReport plan(String goal, ExecutionMode mode, EventBusCustomizer extra) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal must not be blank");
        }
        String traceId = ExecutionContext.newTraceId(TRACE_PREFIX);
        ExecutionContext root = ExecutionContext.root(traceId, mode, Map.of("goal", goal));
        EventBus eventBus = new EventBus(eventProperties.isPropagateSubscriberFailures());
        customizers.forEach(c -> c.customize(eventBus));
        if (extra != null) {
            extra.customize(eventBus);
        }

        MdcContext.set(root);
        try {
            log.info("Planning goal '{}' [trace: {}]", goal, traceId);
            eventBus.emit(EventTypes.AGENT_PLAN, Map.of("goal", goal), root);

            // trace ids have second resolution; a rerun within the same second starts clean
            store.clear(traceId);
            List<Subtask> subtasks = decompose(goal);
            log.info("Decomposed into {} subtasks", subtasks.size());

            RunStatus status = RunStatus.COMPLETED;
            String cause = null;
            try {
                ScopeOutcome outcome = TaskScope.run(SCOPE_NAME, root, eventBus, taskExecutor, scope -> {
                    for (Subtask subtask : subtasks) {
                        TaskHandle handle = scope.spawn(spanName(subtask),
                                context -> execute(subtask, traceId, eventBus, context));
                        if (scope.join(handle) != TaskState.COMPLETED) {
                            return;
                        }
                    }
                });
                if (outcome.cancelled()) {
                    status = RunStatus.CANCELLED;
                    cause = "Plan cancelled (" + outcome.reason() + "): " + outcome.message();
                }
            } catch (RuntimeException e) {
                status = RunStatus.FAILED;
                cause = "Plan failed: " + e.getMessage();
                log.error("Plan {} failed", traceId, e);
            }

            List<SubtaskResult> results = store.results(traceId);
            var done = new LinkedHashMap<String, Object>();
            done.put("goal", goal);
            done.put("results", results.stream().map(SubtaskResult::toPayload).toList());
            done.put("total_tasks", subtasks.size());
            done.put("status", status.name());
            eventBus.emit(EventTypes.PLAN_DONE, done, root);

            log.info("Goal '{}' finished {}", goal, status);
            return new PlanReport(traceId, goal, status, cause, subtasks, results, eventBus.size());
        } finally {
            MdcContext.clear();
        }
    }

    private void execute(Subtask subtask, String traceId, EventBus eventBus, ExecutionContext context)
            throws Exception {
        Decision decision = gateway.validate(subtask.name(), subtask.intent(), context);
        metrics.recordValidation(decision);

        if (!decision.isAllowed()) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("task", subtask.name());
            payload.put("validated", false);
            payload.put("category", decision.category().name());
            payload.put("reason", decision.reason());
            eventBus.emit(EventTypes.AGENT_REJECTED, payload, context);
            SubtaskResult rejected = SubtaskResult.rejected(subtask, decision.reason());
            store.put(traceId, rejected);
            if (decision.isSelfPreservationVeto()) {
                throw new CancellationSignal(CancellationSignal.Reason.SELF_PRESERVATION,
                        "Subtask '" + subtask.name() + "' rejected: " + decision.reason());
            }
            log.warn("Subtask '{}' rejected: {}", subtask.name(), decision.reason());
            return;
        }

        var validated = new LinkedHashMap<String, Object>();
        validated.put("task", subtask.name());
        validated.put("validated", true);
        validated.put("warnings", decision.warnings());
        eventBus.emit(EventTypes.AGENT_VALIDATED, validated, context);

        eventBus.emit(EventTypes.AGENT_EXECUTE,
                Map.of("task", subtask.name(), "archetype", subtask.mode().displayName()), context);
        String output = handler.handle(subtask, context);
        SubtaskResult result = SubtaskResult.complete(subtask, output);
        store.put(traceId, result);
        eventBus.emit(EventTypes.AGENT_COMPLETE, result.toPayload(), context);
    }

    /**
     * Span segment for a subtask: its name with everything outside
     * {@code [A-Za-z0-9_-]} replaced, so free-text goals keep the span path intact.
     */
    static String spanName(Subtask subtask) {
        return subtask.name().replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
