package com.sovereign.core.planner;

import com.sovereign.core.engine.RunStatus;

import java.util.List;

/**
 * Outcome of {@link RecursivePlanner#plan}.
 *
 * @param traceId    trace of the plan run
 * @param goal       the goal that was decomposed
 * @param status     terminal status of the plan scope
 * @param cause      readable cause when cancelled or failed, null otherwise
 * @param subtasks   the decomposition
 * @param results    results of the subtasks that reached a decision, in order
 * @param eventCount events recorded on the plan's bus
 */
public record PlanReport(
    String traceId,
    String goal,
    RunStatus status,
    String cause,
    List<Subtask> subtasks,
    List<SubtaskResult> results,
    int eventCount
) {

    public PlanReport {
        subtasks = List.copyOf(subtasks);
        results = List.copyOf(results);
    }
}
