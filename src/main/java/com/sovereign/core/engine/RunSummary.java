package com.sovereign.core.engine;

import java.util.List;

/**
 * Result of a deployment run. Always produced; the orchestrator never throws.
 *
 * @param traceId    trace of the run
 * @param status     terminal status
 * @param cause      human-readable cause when cancelled or failed, null otherwise
 * @param eventCount number of events recorded on the run's bus
 * @param phases     reports of the phases that ran, in order
 */
public record RunSummary(
    String traceId,
    RunStatus status,
    String cause,
    int eventCount,
    List<PhaseReport> phases
) {

    public RunSummary {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
