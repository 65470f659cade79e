package com.sovereign.core.scope;

import com.sovereign.core.context.ExecutionContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One spawned unit of work inside a {@link TaskScope}. Owned by the scope that
 * created it; task bodies never see handles.
 */
public final class TaskHandle {

    private final String name;
    private final ExecutionContext context;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile TaskState state = TaskState.RUNNING;
    private volatile Throwable failure;

    // guarded by this
    private Thread runner;
    private boolean bodyDone;
    private CancellationSignal cancelRequest;

    TaskHandle(String name, ExecutionContext context) {
        this.name = name;
        this.context = context;
    }

    public String name() {
        return name;
    }

    public ExecutionContext context() {
        return context;
    }

    public TaskState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Failure recorded for a {@link TaskState#FAILED} handle, null otherwise.
     */
    public Throwable failure() {
        return failure;
    }

    synchronized CancellationSignal cancelRequest() {
        return cancelRequest;
    }

    /**
     * Blocks until the handle reaches a terminal state.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /**
     * Binds the running thread. Returns false when a cancel request arrived
     * before the body could start, in which case the body must not run.
     */
    synchronized boolean markRunning(Thread thread) {
        if (cancelRequest != null) {
            return false;
        }
        runner = thread;
        return true;
    }

    /**
     * Unbinds the runner once the body has returned or thrown, so later cancel
     * requests cannot interrupt a pooled thread that moved on.
     */
    synchronized void markBodyDone() {
        runner = null;
        bodyDone = true;
    }

    /**
     * Requests cooperative cancellation. No-op once the body is done.
     *
     * @return true when the request was recorded
     */
    synchronized boolean requestCancel(CancellationSignal signal) {
        if (bodyDone || cancelRequest != null || state.isTerminal()) {
            return false;
        }
        cancelRequest = signal;
        if (runner != null) {
            runner.interrupt();
        }
        return true;
    }

    void finish(TaskState terminal, Throwable failure) {
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            this.failure = failure;
            this.runner = null;
            this.bodyDone = true;
            this.state = terminal;
        }
        terminated.countDown();
    }

    @Override
    public String toString() {
        return "TaskHandle[" + name + ", " + state + "]";
    }
}
