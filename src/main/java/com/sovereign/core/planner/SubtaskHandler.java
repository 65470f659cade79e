package com.sovereign.core.planner;

import com.sovereign.core.context.ExecutionContext;

/**
 * Performs a validated subtask. Runs on a task thread; may block, and should
 * give up promptly when interrupted.
 */
@FunctionalInterface
public interface SubtaskHandler {

    /**
     * @return the subtask's output, stored in the {@link PlanResultStore}
     */
    String handle(Subtask subtask, ExecutionContext context) throws Exception;
}
