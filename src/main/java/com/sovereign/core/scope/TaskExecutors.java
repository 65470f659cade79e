package com.sovereign.core.scope;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executor that runs scope tasks.
 */
public final class TaskExecutors {

    private TaskExecutors() {}

    /**
     * Unbounded pool of daemon threads named {@code <prefix>-N}. A task waiting
     * on a nested scope must never keep that scope's children from a thread.
     */
    public static ExecutorService newTaskExecutor(String prefix) {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
