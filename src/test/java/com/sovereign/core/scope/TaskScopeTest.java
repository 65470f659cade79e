package com.sovereign.core.scope;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.events.SovereignEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TaskScopeTest {

    private ExecutorService executor;
    private EventBus bus;
    private ExecutionContext root;

    @BeforeEach
    void setUp() {
        executor = TaskExecutors.newTaskExecutor("test-task");
        bus = new EventBus();
        root = ExecutionContext.root("deploy_20241225_093000", ExecutionMode.ARCHITECT, Map.of());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        Thread.interrupted();
    }

    private static void blockUntilInterrupted() throws InterruptedException {
        new CountDownLatch(1).await();
    }

    private List<String> types() {
        return bus.events().stream().map(SovereignEvent::type).toList();
    }

    private List<SovereignEvent> eventsOfType(String type) {
        return bus.events().stream().filter(e -> e.type().equals(type)).toList();
    }

    private SovereignEvent last() {
        List<SovereignEvent> events = bus.events();
        return events.get(events.size() - 1);
    }

    @Nested
    @DisplayName("normal completion")
    class CompletionTests {

        @Test
        @DisplayName("all children complete and the outcome reports them")
        void allComplete() {
            List<TaskHandle> handles = new ArrayList<>();

            ScopeOutcome outcome = TaskScope.run("repo_prep", root, bus, executor, scope -> {
                handles.add(scope.spawn("git_init", ctx -> { }));
                handles.add(scope.spawn("git_add", ctx -> { }));
            });

            assertFalse(outcome.cancelled());
            assertNull(outcome.reason());
            assertEquals(2, outcome.completed());
            assertEquals(0, outcome.cancelledTasks());
            assertEquals("root.repo_prep", outcome.spanId());
            handles.forEach(h -> assertEquals(TaskState.COMPLETED, h.state()));
            assertEquals(2, eventsOfType(EventTypes.TASK_COMPLETE).size());
            assertEquals(EventTypes.SCOPE_ENTER, types().get(0));
        }

        @Test
        @DisplayName("children receive derived contexts under the scope span")
        void childContexts() {
            List<ExecutionContext> seen = new java.util.concurrent.CopyOnWriteArrayList<>();

            TaskScope.run("repo_prep", root, bus, executor, scope -> {
                scope.spawn("git_init", seen::add);
                scope.spawn("git_add", seen::add);
            });

            assertEquals(2, seen.size());
            for (ExecutionContext ctx : seen) {
                assertEquals(root.traceId(), ctx.traceId());
                assertEquals("root.repo_prep", ctx.metadata().get(ExecutionContext.PARENT_SPAN_KEY));
                assertTrue(ctx.spanId().equals("root.repo_prep.git_init") || ctx.spanId().equals("root.repo_prep.git_add"));
            }
        }

        @Test
        @DisplayName("exit waits until every child is terminal")
        void exitWaitsForChildren() {
            var finished = new AtomicBoolean();
            AtomicReference<TaskHandle> slow = new AtomicReference<>();

            TaskScope.run("commit", root, bus, executor, scope ->
                    slow.set(scope.spawn("slow", ctx -> {
                        Thread.sleep(200);
                        finished.set(true);
                    })));

            assertTrue(finished.get());
            assertTrue(slow.get().isTerminal());
        }

        @Test
        @DisplayName("scope.exit is emitted after every child event")
        void exitEventLast() {
            TaskScope.run("repo_prep", root, bus, executor, scope -> {
                for (int i = 0; i < 5; i++) {
                    scope.spawn("t" + i, ctx -> {
                        Thread.sleep(20);
                        bus.emit("custom", Map.of(), ctx);
                    });
                }
            });

            SovereignEvent exit = last();
            assertEquals(EventTypes.SCOPE_EXIT, exit.type());
            assertEquals("root.repo_prep", exit.spanId());
            assertEquals(false, exit.payload().get("cancelled"));
            assertNull(exit.payload().get("signal"));
            assertEquals(5, exit.payload().get("tasks"));
            assertEquals(5, eventsOfType("custom").size());
        }

        @Test
        @DisplayName("each task's events are in program order")
        void perTaskOrder() {
            TaskScope.run("repo_prep", root, bus, executor, scope -> scope.spawn("git_init", ctx -> { }));

            List<String> taskEvents = bus.eventsUnder("root.repo_prep.git_init").stream()
                    .map(SovereignEvent::type).toList();
            assertEquals(List.of(EventTypes.TASK_START, EventTypes.TASK_COMPLETE), taskEvents);
        }

        @Test
        @DisplayName("close() exits an open scope")
        void autoClose() {
            TaskHandle handle;
            try (TaskScope scope = TaskScope.open("commit", root, bus, executor)) {
                handle = scope.spawn("git_commit", ctx -> Thread.sleep(50));
            }

            assertEquals(TaskState.COMPLETED, handle.state());
            assertEquals(EventTypes.SCOPE_EXIT, last().type());
        }

        @Test
        @DisplayName("an empty scope emits enter and exit only")
        void emptyScope() {
            ScopeOutcome outcome = TaskScope.run("meta_analysis", root, bus, executor, scope -> { });

            assertEquals(0, outcome.taskCount());
            assertEquals(List.of(EventTypes.SCOPE_ENTER, EventTypes.SCOPE_EXIT), types());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("a child's self-preservation signal cancels every sibling and is absorbed")
        void selfPreservationCancelsSiblings() {
            List<TaskHandle> handles = new java.util.concurrent.CopyOnWriteArrayList<>();

            ScopeOutcome outcome = TaskScope.run("github_deploy", root, bus, executor, scope -> {
                handles.add(scope.spawn("sibling_a", ctx -> blockUntilInterrupted()));
                handles.add(scope.spawn("sibling_b", ctx -> blockUntilInterrupted()));
                handles.add(scope.spawn("vetoed", ctx -> {
                    throw new CancellationSignal(CancellationSignal.Reason.SELF_PRESERVATION, "Action rejected");
                }));
            });

            assertTrue(outcome.cancelled());
            assertEquals(CancellationSignal.Reason.SELF_PRESERVATION, outcome.reason());
            assertEquals("Action rejected", outcome.message());
            assertEquals(3, outcome.cancelledTasks());
            handles.forEach(h -> assertEquals(TaskState.CANCELLED, h.state(), h.name()));
            assertTrue(eventsOfType(EventTypes.TASK_ERROR).isEmpty());
            assertEquals(3, eventsOfType(EventTypes.TASK_CANCELLED).size());

            SovereignEvent exit = last();
            assertEquals(EventTypes.SCOPE_EXIT, exit.type());
            assertEquals(true, exit.payload().get("cancelled"));
            assertEquals("SELF_PRESERVATION", exit.payload().get("signal"));
        }

        @Test
        @DisplayName("the vetoed task reports its own reason")
        void vetoedTaskEvent() {
            TaskScope.run("commit", root, bus, executor, scope -> scope.spawn("git_commit", ctx -> {
                throw new CancellationSignal(CancellationSignal.Reason.SELF_PRESERVATION, "no");
            }));

            SovereignEvent cancelled = eventsOfType(EventTypes.TASK_CANCELLED).get(0);
            assertEquals("git_commit", cancelled.payload().get("task"));
            assertEquals("SELF_PRESERVATION", cancelled.payload().get("reason"));
            assertEquals("root.commit.git_commit", cancelled.spanId());
        }

        @Test
        @DisplayName("a body that throws a cancellation signal cancels running children")
        void bodyCancellation() {
            AtomicReference<TaskHandle> child = new AtomicReference<>();

            ScopeOutcome outcome = TaskScope.run("repo_prep", root, bus, executor, scope -> {
                child.set(scope.spawn("git_add", ctx -> blockUntilInterrupted()));
                throw new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "stop");
            });

            assertTrue(outcome.cancelled());
            assertEquals(CancellationSignal.Reason.EXTERNAL, outcome.reason());
            assertEquals(TaskState.CANCELLED, child.get().state());
        }

        @Test
        @DisplayName("a handle cancelled before its body starts never runs the body")
        void cancelBeforeStart() {
            List<Runnable> queued = new ArrayList<>();
            var ran = new AtomicBoolean();
            TaskScope scope = TaskScope.open("repo_prep", root, bus, queued::add);
            TaskHandle handle = scope.spawn("git_init", ctx -> ran.set(true));

            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "user abort"));
            queued.forEach(Runnable::run);
            ScopeOutcome outcome = scope.exit(null);

            assertFalse(ran.get());
            assertEquals(TaskState.CANCELLED, handle.state());
            assertTrue(outcome.cancelled());
            assertEquals(CancellationSignal.Reason.EXTERNAL, outcome.reason());
        }

        @Test
        @DisplayName("tasks spawned after cancellation are cancelled without running")
        void spawnAfterCancel() {
            List<Runnable> queued = new ArrayList<>();
            var ran = new AtomicBoolean();
            TaskScope scope = TaskScope.open("repo_prep", root, bus, queued::add);

            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "user abort"));
            TaskHandle handle = scope.spawn("late", ctx -> ran.set(true));
            queued.forEach(Runnable::run);
            scope.exit(null);

            assertFalse(ran.get());
            assertEquals(TaskState.CANCELLED, handle.state());
        }

        @Test
        @DisplayName("the first cancellation signal wins")
        void firstSignalWins() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            scope.cancel(new CancellationSignal(CancellationSignal.Reason.TIMEOUT, "first"));
            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "second"));

            ScopeOutcome outcome = scope.exit(null);

            assertEquals(CancellationSignal.Reason.TIMEOUT, outcome.reason());
            assertEquals("first", outcome.message());
        }

        @Test
        @DisplayName("cancelling a closed scope is a no-op")
        void cancelAfterClose() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            scope.exit(null);
            int before = bus.size();

            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "late"));

            assertFalse(scope.isCancelled());
            assertEquals(before, bus.size());
        }

        @Test
        @DisplayName("cancellation is cooperative: a body that ignores it runs to its end and completes")
        void cooperativeOnly() throws InterruptedException {
            var release = new AtomicBoolean();
            var reachedEnd = new AtomicBoolean();
            var started = new CountDownLatch(1);
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            TaskHandle handle = scope.spawn("stubborn", ctx -> {
                started.countDown();
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                reachedEnd.set(true);
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));

            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "stop"));
            assertFalse(handle.isTerminal());
            release.set(true);
            ScopeOutcome outcome = scope.exit(null);

            // returned with the interrupt from the request still pending
            assertTrue(reachedEnd.get());
            assertEquals(TaskState.COMPLETED, handle.state());
            assertTrue(outcome.cancelled());
            assertEquals(1, outcome.completed());
            assertTrue(types().contains(EventTypes.TASK_COMPLETE));
            assertFalse(types().contains(EventTypes.TASK_CANCELLED));
        }

        @Test
        @DisplayName("an ordinary exception after a cancel request without interruption is still a failure")
        void failureAfterRequest() throws InterruptedException {
            var release = new AtomicBoolean();
            var started = new CountDownLatch(1);
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            TaskHandle handle = scope.spawn("stubborn", ctx -> {
                started.countDown();
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                Thread.interrupted();
                throw new IllegalStateException("broken anyway");
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));

            scope.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "stop"));
            release.set(true);

            assertThrows(TaskFailedException.class, () -> scope.exit(null));
            assertEquals(TaskState.FAILED, handle.state());
        }
    }

    @Nested
    @DisplayName("deadline")
    class DeadlineTests {

        @Test
        @DisplayName("an elapsed deadline cancels the scope with TIMEOUT")
        void deadlineCancels() {
            AtomicReference<TaskHandle> child = new AtomicReference<>();

            ScopeOutcome outcome = TaskScope.run("github_deploy", root, bus, executor, Duration.ofMillis(100),
                    scope -> child.set(scope.spawn("git_push", ctx -> blockUntilInterrupted())));

            assertTrue(outcome.cancelled());
            assertEquals(CancellationSignal.Reason.TIMEOUT, outcome.reason());
            assertEquals(TaskState.CANCELLED, child.get().state());
            assertEquals("TIMEOUT", last().payload().get("signal"));
        }

        @Test
        @DisplayName("join inside the body honours the deadline")
        void joinHonoursDeadline() {
            AtomicReference<TaskState> joined = new AtomicReference<>();

            ScopeOutcome outcome = TaskScope.run("repo_prep", root, bus, executor, Duration.ofMillis(100), scope -> {
                TaskHandle handle = scope.spawn("git_init", ctx -> blockUntilInterrupted());
                joined.set(scope.join(handle));
            });

            assertEquals(TaskState.CANCELLED, joined.get());
            assertEquals(CancellationSignal.Reason.TIMEOUT, outcome.reason());
        }

        @Test
        @DisplayName("a scope finishing within its deadline is not cancelled")
        void withinDeadline() {
            ScopeOutcome outcome = TaskScope.run("commit", root, bus, executor, Duration.ofSeconds(5),
                    scope -> scope.spawn("git_commit", ctx -> { }));

            assertFalse(outcome.cancelled());
        }

        @Test
        @DisplayName("rejects a non-positive deadline")
        void rejectsZeroDeadline() {
            assertThrows(IllegalArgumentException.class,
                    () -> TaskScope.open("commit", root, bus, executor, Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("failure")
    class FailureTests {

        @Test
        @DisplayName("a failing child cancels its siblings and is rethrown after cleanup")
        void failFast() {
            List<TaskHandle> handles = new java.util.concurrent.CopyOnWriteArrayList<>();

            var thrown = assertThrows(TaskFailedException.class, () ->
                    TaskScope.run("repo_prep", root, bus, executor, scope -> {
                        handles.add(scope.spawn("waiting", ctx -> blockUntilInterrupted()));
                        handles.add(scope.spawn("broken", ctx -> {
                            throw new IllegalStateException("boom");
                        }));
                    }));

            assertEquals("broken", thrown.taskName());
            assertEquals("root.repo_prep.broken", thrown.context().spanId());
            assertInstanceOf(IllegalStateException.class, thrown.getCause());
            assertTrue(thrown.getMessage().contains("boom"));

            assertEquals(TaskState.CANCELLED, handles.get(0).state());
            assertEquals(TaskState.FAILED, handles.get(1).state());
            assertSame(thrown, handles.get(1).failure());

            SovereignEvent error = eventsOfType(EventTypes.TASK_ERROR).get(0);
            assertEquals("boom", error.payload().get("error"));
            SovereignEvent exit = last();
            assertEquals(EventTypes.SCOPE_EXIT, exit.type());
            assertEquals("FAILURE", exit.payload().get("signal"));
            assertEquals(false, exit.payload().get("cancelled"));
        }

        @Test
        @DisplayName("a body failure is rethrown with child failures suppressed")
        void bodyFailureSuppressesChildFailures() {
            var thrown = assertThrows(IllegalArgumentException.class, () ->
                    TaskScope.run("repo_prep", root, bus, executor, scope -> {
                        TaskHandle broken = scope.spawn("broken", ctx -> {
                            throw new IllegalStateException("boom");
                        });
                        assertEquals(TaskState.FAILED, scope.join(broken));
                        throw new IllegalArgumentException("body gave up");
                    }));

            assertEquals(1, thrown.getSuppressed().length);
            assertInstanceOf(TaskFailedException.class, thrown.getSuppressed()[0]);
        }

        @Test
        @DisplayName("a body's runtime exception is rethrown as is after children terminate")
        void bodyRuntimeException() {
            AtomicReference<TaskHandle> child = new AtomicReference<>();

            var thrown = assertThrows(IllegalArgumentException.class, () ->
                    TaskScope.run("commit", root, bus, executor, scope -> {
                        child.set(scope.spawn("git_commit", ctx -> blockUntilInterrupted()));
                        throw new IllegalArgumentException("bad body");
                    }));

            assertEquals("bad body", thrown.getMessage());
            assertEquals(TaskState.CANCELLED, child.get().state());
            assertEquals(EventTypes.SCOPE_EXIT, last().type());
        }

        @Test
        @DisplayName("a body's checked exception is wrapped in ScopeFailedException")
        void bodyCheckedException() {
            var thrown = assertThrows(ScopeFailedException.class, () ->
                    TaskScope.run("commit", root, bus, executor, scope -> {
                        throw new IOException("disk");
                    }));

            assertInstanceOf(IOException.class, thrown.getCause());
        }
    }

    @Nested
    @DisplayName("lifecycle rules")
    class LifecycleTests {

        @Test
        @DisplayName("duplicate sibling names are rejected")
        void duplicateNames() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            scope.spawn("git_init", ctx -> { });

            assertThrows(IllegalArgumentException.class, () -> scope.spawn("git_init", ctx -> { }));
            scope.exit(null);
        }

        @Test
        @DisplayName("spawn after exit is rejected")
        void spawnAfterExit() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            scope.exit(null);

            assertEquals(ScopeState.CLOSED, scope.state());
            assertThrows(IllegalStateException.class, () -> scope.spawn("late", ctx -> { }));
        }

        @Test
        @DisplayName("a second exit is rejected")
        void secondExit() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            scope.exit(null);

            assertThrows(IllegalStateException.class, () -> scope.exit(null));
        }

        @Test
        @DisplayName("join rejects handles of another scope")
        void joinForeignHandle() {
            TaskScope first = TaskScope.open("first", root, bus, executor);
            TaskScope second = TaskScope.open("second", root, bus, executor);
            TaskHandle handle = first.spawn("task", ctx -> { });

            assertThrows(IllegalArgumentException.class, () -> second.join(handle));
            first.exit(null);
            second.exit(null);
        }

        @Test
        @DisplayName("an interrupted exit cancels children, still waits, and restores the flag")
        void interruptedExit() {
            TaskScope scope = TaskScope.open("repo_prep", root, bus, executor);
            TaskHandle handle = scope.spawn("git_add", ctx -> blockUntilInterrupted());

            Thread.currentThread().interrupt();
            ScopeOutcome outcome = scope.exit(null);

            assertTrue(Thread.interrupted(), "interrupt flag should be restored");
            assertTrue(outcome.cancelled());
            assertEquals(CancellationSignal.Reason.EXTERNAL, outcome.reason());
            assertEquals(TaskState.CANCELLED, handle.state());
        }
    }

    @Nested
    @DisplayName("nested scopes")
    class NestedScopeTests {

        @Test
        @DisplayName("inner task spans extend the outer task span")
        void nestedSpans() {
            AtomicReference<ExecutionContext> leaf = new AtomicReference<>();

            TaskScope.run("outer", root, bus, executor, outer ->
                    outer.spawn("worker", ctx ->
                            TaskScope.run("inner", ctx, bus, executor, inner -> inner.spawn("leaf", leaf::set))));

            assertEquals("root.outer.worker.inner.leaf", leaf.get().spanId());
            assertEquals(root.traceId(), leaf.get().traceId());
        }

        @Test
        @DisplayName("an inner cancellation is absorbed by the inner scope")
        void innerCancellationAbsorbed() {
            AtomicReference<ScopeOutcome> inner = new AtomicReference<>();

            ScopeOutcome outer = TaskScope.run("outer", root, bus, executor, scope ->
                    scope.spawn("worker", ctx -> inner.set(TaskScope.run("inner", ctx, bus, executor, s ->
                            s.spawn("leaf", c -> {
                                throw new CancellationSignal(CancellationSignal.Reason.SELF_PRESERVATION, "veto");
                            })))));

            assertTrue(inner.get().cancelled());
            assertFalse(outer.cancelled());
            assertEquals(1, outer.completed());
        }

        @Test
        @DisplayName("cancelling the outer scope reaches the inner scope's tasks")
        void outerCancellationReachesLeaves() throws InterruptedException {
            var leafStarted = new CountDownLatch(1);
            AtomicReference<ScopeOutcome> inner = new AtomicReference<>();
            AtomicReference<TaskHandle> leaf = new AtomicReference<>();

            TaskScope outer = TaskScope.open("outer", root, bus, executor);
            TaskHandle worker = outer.spawn("worker", ctx -> inner.set(TaskScope.run("inner", ctx, bus, executor, s ->
                    leaf.set(s.spawn("leaf", c -> {
                        leafStarted.countDown();
                        blockUntilInterrupted();
                    })))));
            assertTrue(leafStarted.await(5, TimeUnit.SECONDS));

            outer.cancel(new CancellationSignal(CancellationSignal.Reason.EXTERNAL, "user abort"));
            ScopeOutcome outcome = outer.exit(null);

            assertTrue(outcome.cancelled());
            assertEquals(TaskState.COMPLETED, worker.state(), "the worker returned its cancelled inner outcome");
            assertEquals(TaskState.CANCELLED, leaf.get().state());
            assertTrue(inner.get().cancelled());
            assertEquals(CancellationSignal.Reason.EXTERNAL, inner.get().reason());
        }
    }
}
