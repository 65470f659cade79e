package com.sovereign.core.engine;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventBusCustomizer;
import com.sovereign.core.events.EventLogExporter;
import com.sovereign.core.events.EventProperties;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.exec.GuardedActionRunner;
import com.sovereign.core.logging.MdcContext;
import com.sovereign.core.logging.SensitiveData;
import com.sovereign.core.metrics.SovereignMetrics;
import com.sovereign.core.scope.ScopeOutcome;
import com.sovereign.core.scope.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Runs a deployment as a sequence of phases, each inside its own
 * {@link TaskScope} under the run's root context.
 * <p>
 * A cancelled phase ends the run as {@link RunStatus#CANCELLED}, a failed phase
 * as {@link RunStatus#FAILED}; either way the remaining phases are skipped.
 * Every run gets a fresh {@link EventBus} prepared by the registered
 * {@link EventBusCustomizer}s. Nothing is thrown to the caller; the outcome is
 * the returned {@link RunSummary}.
 */
@Service
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    static final String TRACE_PREFIX = "deploy";

    private final GuardedActionRunner runner;
    private final ExecutorService taskExecutor;
    private final EngineProperties engineProperties;
    private final EventProperties eventProperties;
    private final List<EventBusCustomizer> customizers;
    private final SovereignMetrics metrics;
    private final EventLogExporter exporter;

    public DeploymentOrchestrator(GuardedActionRunner runner, ExecutorService taskExecutor,
                                  EngineProperties engineProperties, EventProperties eventProperties,
                                  List<EventBusCustomizer> customizers, SovereignMetrics metrics,
                                  EventLogExporter exporter) {
        this.runner = runner;
        this.taskExecutor = taskExecutor;
        this.engineProperties = engineProperties;
        this.eventProperties = eventProperties;
        this.customizers = List.copyOf(customizers);
        this.metrics = metrics;
        this.exporter = exporter;
    }

    /**
     * Runs the standard deployment plan.
     */
    public RunSummary deploy(DeploymentRequest request) {
        return deploy(request, null);
    }

    /**
     * Runs the standard deployment plan with an additional per-run subscriber
     * hook, e.g. for console progress output.
     */
    public RunSummary deploy(DeploymentRequest request, EventBusCustomizer extra) {
        String traceId = ExecutionContext.newTraceId(TRACE_PREFIX);
        return run(traceId, request, DeploymentPlan.standard(request, traceId, engineProperties.getCommitTitle()), extra);
    }

    /**
     * Runs {@code phases} in order under a new root context.
     *
     * @param traceId trace of the run
     * @param request run parameters
     * @param phases  phases to run
     * @param extra   additional bus customizer for this run only, may be null
     * @return the run summary
     */
    public RunSummary run(String traceId, DeploymentRequest request, List<Phase> phases, EventBusCustomizer extra) {
        ExecutionContext root = ExecutionContext.root(traceId, request.mode(),
                Map.of(ExecutionContext.REPO_PATH_KEY, request.repoPath()));
        if (request.remoteUrl() != null) {
            root = root.withMetadata(ExecutionContext.REMOTE_URL_KEY, request.remoteUrl());
        }

        EventBus eventBus = new EventBus(eventProperties.isPropagateSubscriberFailures());
        customizers.forEach(c -> c.customize(eventBus));
        if (extra != null) {
            extra.customize(eventBus);
        }

        MdcContext.set(root);
        RunStatus status = RunStatus.COMPLETED;
        String cause = null;
        var reports = new ArrayList<PhaseReport>();
        try {
            log.info("Starting deployment {} in mode {} for {} ({} phases)",
                    traceId, request.mode(), request.repoPath(), phases.size());
            var started = new LinkedHashMap<String, Object>();
            started.put("mode", request.mode().name());
            started.put("repo", request.repoPath());
            started.put("remote", SensitiveData.mask(request.remoteUrl()));
            started.put("phases", phases.stream().map(Phase::name).toList());
            eventBus.emit(EventTypes.DEPLOY_STARTED, started, root);

            var runtime = new PhaseRuntime(eventBus, runner);
            for (Phase phase : phases) {
                long start = System.nanoTime();
                RunStatus phaseStatus;
                try {
                    ScopeOutcome outcome = TaskScope.run(phase.name(), root, eventBus, taskExecutor, phaseDeadline(),
                            scope -> phase.execute(scope, runtime));
                    if (outcome.cancelled()) {
                        phaseStatus = RunStatus.CANCELLED;
                        cause = "Phase '" + phase.name() + "' cancelled (" + outcome.reason() + "): " + outcome.message();
                    } else {
                        phaseStatus = RunStatus.COMPLETED;
                    }
                } catch (RuntimeException e) {
                    phaseStatus = RunStatus.FAILED;
                    cause = "Phase '" + phase.name() + "' failed: " + e.getMessage();
                    log.error("Deployment {} phase '{}' failed", traceId, phase.name(), e);
                }
                long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
                metrics.recordPhaseDuration(phase.name(), durationMs);
                reports.add(new PhaseReport(phase.name(), phaseStatus, durationMs));
                if (phaseStatus != RunStatus.COMPLETED) {
                    status = phaseStatus;
                    break;
                }
            }

            var finished = new LinkedHashMap<String, Object>();
            finished.put("status", status.name());
            finished.put("cause", cause);
            finished.put("phases", reports.size());
            eventBus.emit(EventTypes.DEPLOY_FINISHED, finished, root);
        } catch (RuntimeException e) {
            status = RunStatus.FAILED;
            cause = "Deployment aborted: " + e.getMessage();
            log.error("Deployment {} aborted", traceId, e);
        } finally {
            MdcContext.clear();
        }

        if (status == RunStatus.CANCELLED) {
            log.warn("Deployment {} cancelled: {}", traceId, cause);
        } else if (status == RunStatus.COMPLETED) {
            log.info("Deployment {} completed ({} events)", traceId, eventBus.size());
        }
        metrics.recordRunResult(status.name());
        exportEventLog(eventBus, request.eventLogPath() != null ? request.eventLogPath() : eventProperties.getLogPath());
        return new RunSummary(traceId, status, cause, eventBus.size(), reports);
    }

    private Duration phaseDeadline() {
        int seconds = engineProperties.getPhaseTimeoutSeconds();
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    private void exportEventLog(EventBus eventBus, String logPath) {
        if (logPath == null || logPath.isBlank()) {
            return;
        }
        try {
            exporter.export(eventBus.events(), Path.of(logPath));
        } catch (UncheckedIOException e) {
            log.warn("Could not export event log to {}: {}", logPath, e.getMessage());
        }
    }
}
