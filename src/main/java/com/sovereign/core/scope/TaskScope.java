package com.sovereign.core.scope;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Structured-concurrency boundary: owns the tasks spawned in it and does not
 * return from {@link #exit} until every one of them is terminal.
 * <p>
 * Lifecycle is {@code OPEN -> DRAINING -> CLOSED}. Spawning is only allowed
 * while open. A {@link CancellationSignal} raised by any child cancels the
 * scope: every running sibling gets a cancel request and the exit returns
 * normally with {@code cancelled=true}. Any other child failure cancels the
 * siblings too (fail-fast) and is rethrown from {@link #exit} once they have
 * all terminated. Cancellation is cooperative: running bodies are interrupted,
 * never stopped forcibly.
 * <p>
 * Events: {@code scope.enter} on open; {@code task.start} and one of
 * {@code task.complete}, {@code task.cancelled}, {@code task.error} per child;
 * {@code scope.exit} last, after every child event.
 *
 * <pre>{@code
 * ScopeOutcome outcome = TaskScope.run("repo_prep", rootContext, eventBus, executor, scope -> {
 *     scope.spawn("git_init", ctx -> runner.run(eventBus, ctx, "git init", "Initialize repository"));
 *     scope.spawn("git_add", ctx -> runner.run(eventBus, ctx, "git add .", "Stage files for deployment"));
 * });
 * }</pre>
 */
public final class TaskScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScope.class);

    private final String name;
    private final ExecutionContext context;
    private final EventBus eventBus;
    private final Executor executor;
    private final long deadlineAtNanos;
    private final boolean hasDeadline;
    private final AtomicBoolean deadlineFired = new AtomicBoolean();

    private final Object lock = new Object();
    // guarded by lock
    private final List<TaskHandle> handles = new ArrayList<>();
    private final Set<String> childNames = new HashSet<>();
    private final List<TaskFailedException> failures = new ArrayList<>();
    private ScopeState state = ScopeState.OPEN;
    private CancellationSignal cancellation;

    private TaskScope(String name, ExecutionContext parent, EventBus eventBus, Executor executor, Duration deadline) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = parent.deriveChild(name);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be > 0");
        }
        this.hasDeadline = deadline != null;
        this.deadlineAtNanos = deadline != null ? System.nanoTime() + deadline.toNanos() : 0L;
    }

    /**
     * Opens a scope under {@code parent} and emits {@code scope.enter}. The
     * scope's own context is {@code parent.deriveChild(name)}.
     */
    public static TaskScope open(String name, ExecutionContext parent, EventBus eventBus, Executor executor) {
        return open(name, parent, eventBus, executor, null);
    }

    /**
     * Opens a scope with a deadline. When the deadline passes while
     * {@link #exit} is waiting, the scope cancels itself with
     * {@link CancellationSignal.Reason#TIMEOUT}.
     */
    public static TaskScope open(String name, ExecutionContext parent, EventBus eventBus,
                                 Executor executor, Duration deadline) {
        var scope = new TaskScope(name, parent, eventBus, executor, deadline);
        log.debug("Entering scope '{}' [span: {}]", name, scope.context.spanId());
        eventBus.emit(EventTypes.SCOPE_ENTER, Map.of("scope", name), scope.context);
        return scope;
    }

    /**
     * Opens a scope, runs {@code body} in it, and exits with whatever the body
     * threw as the outcome signal.
     */
    public static ScopeOutcome run(String name, ExecutionContext parent, EventBus eventBus,
                                   Executor executor, ScopeBody body) {
        return run(name, parent, eventBus, executor, null, body);
    }

    public static ScopeOutcome run(String name, ExecutionContext parent, EventBus eventBus,
                                   Executor executor, Duration deadline, ScopeBody body) {
        TaskScope scope = open(name, parent, eventBus, executor, deadline);
        Throwable signal = null;
        try {
            body.accept(scope);
        } catch (Throwable t) {
            signal = t;
        }
        return scope.exit(signal);
    }

    public String name() {
        return name;
    }

    public ExecutionContext context() {
        return context;
    }

    public ScopeState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancellation != null;
        }
    }

    /**
     * Spawns a child task.
     *
     * @param taskName unique among this scope's children; becomes the last span segment
     * @param task     body, run on the scope's executor with the child context
     * @return the handle owned by this scope
     * @throws IllegalStateException    if the scope is no longer open
     * @throws IllegalArgumentException if a sibling already uses {@code taskName}
     */
    public TaskHandle spawn(String taskName, ScopeTask task) {
        Objects.requireNonNull(task, "task");
        TaskHandle handle;
        CancellationSignal pending;
        synchronized (lock) {
            if (state != ScopeState.OPEN) {
                throw new IllegalStateException("Scope '" + name + "' is " + state + ", cannot spawn '" + taskName + "'");
            }
            if (!childNames.add(taskName)) {
                throw new IllegalArgumentException("Scope '" + name + "' already has a task named '" + taskName + "'");
            }
            handle = new TaskHandle(taskName, context.deriveChild(taskName));
            handles.add(handle);
            pending = cancellation;
        }
        if (pending != null) {
            handle.requestCancel(pending);
        }

        try {
            executor.execute(() -> runTask(handle, task));
        } catch (RejectedExecutionException e) {
            reportFailure(handle, e);
        }
        return handle;
    }

    /**
     * Cancels the scope from outside: records {@code signal} (the first signal
     * wins) and requests cancellation of every running child. No-op once closed.
     */
    public void cancel(CancellationSignal signal) {
        Objects.requireNonNull(signal, "signal");
        List<TaskHandle> running;
        synchronized (lock) {
            if (state == ScopeState.CLOSED) {
                return;
            }
            if (cancellation == null) {
                cancellation = signal;
                log.info("Scope '{}' cancelled ({}) - propagating to {} children",
                        name, signal.reason(), handles.size());
            }
            running = List.copyOf(handles);
        }
        for (TaskHandle handle : running) {
            handle.requestCancel(signal);
        }
    }

    /**
     * Exit sequence: stops accepting spawns, propagates cancellation when the
     * scope or a child was cancelled or a child failed, waits for every child
     * to terminate, then emits {@code scope.exit}.
     *
     * @param signal what terminated the scope body, or null for a normal end
     * @return the outcome when the scope completed or was cancelled
     * @throws TaskFailedException  the first child failure, others suppressed
     * @throws ScopeFailedException the body threw a checked exception
     */
    public ScopeOutcome exit(Throwable signal) {
        synchronized (lock) {
            if (state != ScopeState.OPEN) {
                throw new IllegalStateException("Scope '" + name + "' has already exited");
            }
            state = ScopeState.DRAINING;
        }

        boolean interrupted = false;
        if (signal instanceof InterruptedException) {
            interrupted = true;
            signal = new CancellationSignal(CancellationSignal.Reason.EXTERNAL,
                    "Scope '" + name + "' interrupted", signal);
        }
        if (signal instanceof CancellationSignal cancellationSignal) {
            cancel(cancellationSignal);
        } else if (signal != null || hasFailures()) {
            cancelRunning(new CancellationSignal(CancellationSignal.Reason.SIBLING_FAILURE,
                    "Scope '" + name + "' is failing"));
        }

        awaitChildren(interrupted);

        List<TaskHandle> finished;
        CancellationSignal cancelledBy;
        List<TaskFailedException> childFailures;
        synchronized (lock) {
            state = ScopeState.CLOSED;
            finished = List.copyOf(handles);
            cancelledBy = cancellation;
            childFailures = List.copyOf(failures);
        }

        int completed = count(finished, TaskState.COMPLETED);
        int cancelledTasks = count(finished, TaskState.CANCELLED);
        boolean failing = (signal != null && !(signal instanceof CancellationSignal)) || !childFailures.isEmpty();

        var payload = new LinkedHashMap<String, Object>();
        payload.put("scope", name);
        payload.put("cancelled", cancelledBy != null);
        payload.put("signal", failing ? "FAILURE" : cancelledBy != null ? cancelledBy.reason().name() : null);
        payload.put("tasks", finished.size());
        if (failing) {
            Throwable cause = signal != null && !(signal instanceof CancellationSignal) ? signal : childFailures.get(0);
            payload.put("error", cause.getMessage());
        }
        eventBus.emit(EventTypes.SCOPE_EXIT, payload, context);

        if (signal != null && !(signal instanceof CancellationSignal)) {
            Throwable bodyFailure = signal;
            childFailures.stream().filter(f -> f != bodyFailure).forEach(bodyFailure::addSuppressed);
            log.error("Scope '{}' failed: {}", name, signal.getMessage());
            throw rethrowable(signal);
        }
        if (!childFailures.isEmpty()) {
            TaskFailedException first = childFailures.get(0);
            childFailures.stream().skip(1).forEach(first::addSuppressed);
            log.error("Scope '{}' failed: {}", name, first.getMessage());
            throw first;
        }

        if (cancelledBy != null) {
            log.info("Scope '{}' ended by cancellation ({}): {}", name, cancelledBy.reason(), cancelledBy.getMessage());
        } else {
            log.debug("Scope '{}' exited normally with {} tasks", name, finished.size());
        }
        return new ScopeOutcome(name, context.traceId(), context.spanId(), cancelledBy != null,
                cancelledBy != null ? cancelledBy.reason() : null,
                cancelledBy != null ? cancelledBy.getMessage() : null,
                completed, cancelledTasks);
    }

    /**
     * Exits with no signal if the scope is still open.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (state != ScopeState.OPEN) {
                return;
            }
        }
        exit(null);
    }

    /**
     * Waits for one of this scope's children from inside the scope body,
     * honouring the scope deadline. Used by bodies that run steps in order.
     *
     * @return the terminal state of the handle
     */
    public TaskState join(TaskHandle handle) throws InterruptedException {
        synchronized (lock) {
            if (!handles.contains(handle)) {
                throw new IllegalArgumentException("Task '" + handle.name() + "' does not belong to scope '" + name + "'");
            }
        }
        while (!handle.isTerminal()) {
            awaitStep(handle);
        }
        return handle.state();
    }

    private void runTask(TaskHandle handle, ScopeTask task) {
        ExecutionContext childContext = handle.context();
        MdcContext.set(childContext);
        try {
            eventBus.emit(EventTypes.TASK_START, Map.of("task", handle.name()), childContext);
            if (!handle.markRunning(Thread.currentThread())) {
                completeCancelled(handle, handle.cancelRequest());
                return;
            }

            Throwable thrown = null;
            try {
                task.run(childContext);
            } catch (Throwable t) {
                thrown = t;
            } finally {
                handle.markBodyDone();
            }
            boolean interrupted = Thread.interrupted();
            CancellationSignal requested = handle.cancelRequest();

            // a body that returned finished its work, whatever arrived after
            if (thrown == null) {
                eventBus.emit(EventTypes.TASK_COMPLETE, Map.of("task", handle.name()), childContext);
                handle.finish(TaskState.COMPLETED, null);
            } else if (requested != null && (interrupted || isCancellation(thrown))) {
                completeCancelled(handle, requested);
            } else if (thrown instanceof CancellationSignal signal) {
                completeCancelled(handle, signal);
            } else if (thrown instanceof InterruptedException) {
                completeCancelled(handle, new CancellationSignal(CancellationSignal.Reason.EXTERNAL,
                        "Task '" + handle.name() + "' interrupted", thrown));
            } else {
                completeFailed(handle, thrown);
            }
        } catch (RuntimeException e) {
            // lifecycle event delivery failed (a subscriber propagating its failure)
            if (handle.isTerminal()) {
                log.warn("Task '{}' finished but its lifecycle event failed: {}", handle.name(), e.getMessage());
            } else {
                reportFailure(handle, e);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void completeCancelled(TaskHandle handle, CancellationSignal signal) {
        try {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("task", handle.name());
            payload.put("reason", signal.reason().name());
            payload.put("message", signal.getMessage());
            eventBus.emit(EventTypes.TASK_CANCELLED, payload, handle.context());
        } finally {
            // a self-raised signal cancels the whole scope before the handle
            // terminates; a propagated request is not re-propagated
            if (handle.cancelRequest() != signal) {
                log.info("Task '{}' cancelled itself ({}): {}", handle.name(), signal.reason(), signal.getMessage());
                cancel(signal);
            }
            handle.finish(TaskState.CANCELLED, null);
        }
    }

    private void completeFailed(TaskHandle handle, Throwable cause) {
        var failure = new TaskFailedException(handle.name(), handle.context(), cause);
        log.error("Task '{}' failed: {}", handle.name(), failure.getMessage());
        try {
            eventBus.emit(EventTypes.TASK_ERROR, errorPayload(handle.name(), cause), handle.context());
        } finally {
            recordFailure(failure);
            cancelRunning(new CancellationSignal(CancellationSignal.Reason.SIBLING_FAILURE,
                    "Sibling task '" + handle.name() + "' failed"));
            handle.finish(TaskState.FAILED, failure);
        }
    }

    private void reportFailure(TaskHandle handle, Throwable cause) {
        try {
            completeFailed(handle, cause);
        } catch (RuntimeException e) {
            log.warn("Could not publish failure of task '{}': {}", handle.name(), e.getMessage());
        }
    }

    private void recordFailure(TaskFailedException failure) {
        synchronized (lock) {
            failures.add(failure);
        }
    }

    private boolean hasFailures() {
        synchronized (lock) {
            return !failures.isEmpty();
        }
    }

    private void cancelRunning(CancellationSignal signal) {
        List<TaskHandle> running;
        synchronized (lock) {
            running = List.copyOf(handles);
        }
        for (TaskHandle handle : running) {
            handle.requestCancel(signal);
        }
    }

    private void awaitChildren(boolean interruptedOnEntry) {
        List<TaskHandle> waitSet;
        synchronized (lock) {
            waitSet = List.copyOf(handles);
        }
        boolean interrupted = interruptedOnEntry;
        for (TaskHandle handle : waitSet) {
            while (!handle.isTerminal()) {
                try {
                    awaitStep(handle);
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL,
                            "Scope '" + name + "' interrupted while waiting for children", e));
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits until the handle terminates or the deadline passes; on the first
     * pass of the deadline the scope cancels itself with TIMEOUT.
     */
    private void awaitStep(TaskHandle handle) throws InterruptedException {
        if (!hasDeadline || deadlineFired.get()) {
            handle.awaitTermination();
            return;
        }
        long remaining = deadlineAtNanos - System.nanoTime();
        if (remaining > 0 && handle.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
            return;
        }
        if (deadlineAtNanos - System.nanoTime() <= 0 && deadlineFired.compareAndSet(false, true)) {
            log.warn("Scope '{}' exceeded its deadline, cancelling", name);
            cancel(new CancellationSignal(CancellationSignal.Reason.TIMEOUT,
                    "Scope '" + name + "' deadline exceeded"));
        }
    }

    private static boolean isCancellation(Throwable thrown) {
        return thrown instanceof CancellationSignal || thrown instanceof InterruptedException;
    }

    private static int count(List<TaskHandle> handles, TaskState state) {
        return (int) handles.stream().filter(h -> h.state() == state).count();
    }

    private static Map<String, Object> errorPayload(String taskName, Throwable cause) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("task", taskName);
        payload.put("error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        return payload;
    }

    private RuntimeException rethrowable(Throwable signal) {
        if (signal instanceof RuntimeException runtime) {
            return runtime;
        }
        if (signal instanceof Error error) {
            throw error;
        }
        return new ScopeFailedException("Scope '" + name + "' body failed: " + signal.getMessage(), signal);
    }
}
