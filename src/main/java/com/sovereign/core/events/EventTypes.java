package com.sovereign.core.events;

/**
 * Event type tags emitted by the engine. Task bodies may emit their own tags
 * in addition to these.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String SCOPE_ENTER = "scope.enter";
    public static final String SCOPE_EXIT = "scope.exit";

    public static final String TASK_START = "task.start";
    public static final String TASK_COMPLETE = "task.complete";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String TASK_ERROR = "task.error";

    public static final String ACTION_VALIDATED = "action.validated";
    public static final String ACTION_REJECTED = "action.rejected";
    public static final String ACTION_WARNING = "action.warning";

    public static final String DEPLOY_STARTED = "deploy.started";
    public static final String DEPLOY_FINISHED = "deploy.finished";
    public static final String ANALYSIS_CONCERNS = "analysis.concerns";

    public static final String AGENT_PLAN = "agent.plan";
    public static final String AGENT_VALIDATED = "agent.validated";
    public static final String AGENT_REJECTED = "agent.rejected";
    public static final String AGENT_EXECUTE = "agent.execute";
    public static final String AGENT_COMPLETE = "agent.complete";
    public static final String PLAN_DONE = "task.done";
}
