package reqpool.pool.service;

import reqpool.pool.config.PoolConfig;
import reqpool.pool.exception.DuplicateTaskException;
import reqpool.pool.exception.PoolShutdownException;
import reqpool.pool.exception.TaskValidationException;
import reqpool.pool.model.DispatchState;
import reqpool.pool.model.PoolStatus;
import reqpool.pool.model.RequestMethod;
import reqpool.pool.model.RequestTask;
import reqpool.pool.model.TaskResult;
import reqpool.pool.model.TaskStatus;
import reqpool.pool.store.InMemoryTaskRegistry;
import reqpool.pool.transport.TransportException;
import reqpool.pool.transport.TransportOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestPoolTest {

    private final List<RequestPool> pools = new ArrayList<>();

    @AfterEach
    void closePools() {
        pools.forEach(RequestPool::close);
    }

    private RequestPool pool(int maxConcurrency, ScriptedTransport transport) {
        RequestPool pool = new RequestPool(config(maxConcurrency), transport);
        pools.add(pool);
        return pool;
    }

    private static PoolConfig config(int maxConcurrency) {
        return PoolConfig.defaults()
                .withMaxConcurrency(maxConcurrency)
                .withIdlePollInterval(Duration.ofMillis(20));
    }

    // ==================== Construction & validation ====================

    @Test
    void rejectsNonPositiveConcurrency() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO);
        assertThrows(IllegalArgumentException.class,
                () -> new RequestPool(config(0), transport));
        assertThrows(IllegalArgumentException.class,
                () -> new RequestPool(config(-3), transport));
    }

    @Test
    void rejectsInvalidTasksWithoutTouchingState() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));

        assertThrows(TaskValidationException.class, () -> pool.submit(null));
        assertThrows(TaskValidationException.class, () -> pool.submitGet(""));
        assertThrows(TaskValidationException.class, () -> pool.submitPost("   ", "a=1"));
        assertThrows(TaskValidationException.class,
                () -> pool.submit(RequestTask.builder().build()));

        assertEquals(0, pool.status().totalTasks());
        assertTrue(pool.listTasks().isEmpty());
        assertEquals(DispatchState.IDLE, pool.dispatchState());
    }

    @Test
    void rejectsDuplicateTaskId() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));

        pool.submit(RequestTask.get("http://localhost/a").id("same").build());
        assertThrows(DuplicateTaskException.class,
                () -> pool.submit(RequestTask.get("http://localhost/b").id("same").build()));

        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertEquals(1, pool.status().totalTasks());
        assertEquals("http://localhost/a", pool.getTask("same").orElseThrow().endpoint());
    }

    @Test
    void rejectsTaskThatAlreadyRan() {
        RequestPool pool = pool(1, ScriptedTransport.succeeding(Duration.ZERO));
        RequestTask task = RequestTask.get("http://localhost/once").build();
        pool.submit(task);
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        RequestPool other = pool(1, ScriptedTransport.succeeding(Duration.ZERO));
        assertThrows(TaskValidationException.class, () -> other.submit(task));
    }

    @Test
    @DisplayName("submitAll keeps the tasks accepted before the failing element")
    void submitAllIsNotAtomic() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));
        RequestTask first = RequestTask.get("http://localhost/1").build();
        RequestTask invalid = RequestTask.get(" ").build();
        RequestTask third = RequestTask.get("http://localhost/3").build();

        assertThrows(TaskValidationException.class, () -> pool.submitAll(List.of(first, invalid, third)));

        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertEquals(1, pool.status().totalTasks());
        assertTrue(pool.getTask(first.id()).isPresent());
        assertTrue(pool.getTask(third.id()).isEmpty());
        assertEquals(TaskStatus.PENDING, third.status());
    }

    // ==================== Dispatch ====================

    @Test
    void zeroTasksCompletesImmediately() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));

        long start = System.nanoTime();
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(1)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 500, "should not wait for the timeout, took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("max 2, five 50ms tasks: never more than 2 running, three waves")
    void fiveTasksWithConcurrencyTwo() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ofMillis(50));
        RequestPool pool = pool(2, transport);

        long start = System.nanoTime();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(pool.submitGet("http://localhost/item/" + i));
        }
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(transport.peak.get() <= 2, "peak concurrency was " + transport.peak.get());
        assertTrue(elapsedMs >= 140, "five tasks at two per wave need three waves, took " + elapsedMs + "ms");
        for (String id : ids) {
            RequestTask task = pool.getTask(id).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, task.status());
            assertNotNull(task.startedAt());
            assertNotNull(task.completedAt());
            assertEquals(200, task.result().statusCode());
        }

        PoolStatus status = pool.status();
        assertEquals(5, status.totalTasks());
        assertEquals(5, status.completedTasks());
        assertEquals(0, status.runningTasks());
        assertEquals(0, status.pendingTasks());
        assertFalse(status.isRunning());
        assertEquals(2, pool.availableSlots());
    }

    @Test
    void runningCountNeverExceedsLimitUnderLoad() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ofMillis(3));
        RequestPool pool = pool(3, transport);
        AtomicInteger observedMax = new AtomicInteger();
        pool.addListener(new PoolListener() {
            @Override
            public void onTaskStarted(RequestTask task) {
                observedMax.accumulateAndGet(pool.status().runningTasks(), Math::max);
            }
        });

        for (int i = 0; i < 60; i++) {
            pool.submitGet("http://localhost/load/" + i);
        }
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(10)));

        assertTrue(transport.peak.get() <= 3, "transport saw " + transport.peak.get());
        assertTrue(observedMax.get() <= 3, "pool reported " + observedMax.get());
        assertEquals(60, pool.status().completedTasks());
        assertEquals(3, pool.availableSlots());
    }

    @Test
    void dispatchesInSubmissionOrderWithSingleSlot() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ofMillis(1));
        RequestPool pool = pool(1, transport);

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String endpoint = "http://localhost/fifo/" + i;
            expected.add(endpoint);
            pool.submitGet(endpoint);
        }
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(expected, transport.calls);
    }

    @Test
    void postTaskCarriesBodyToTransport() {
        AtomicReference<String> seenBody = new AtomicReference<>();
        AtomicReference<RequestMethod> seenMethod = new AtomicReference<>();
        RequestPool pool = new RequestPool(config(1), (endpoint, method, body) -> {
            seenMethod.set(method);
            seenBody.set(body);
            return TransportOutcome.success(TaskResult.success(201, "created"));
        });
        pools.add(pool);

        String id = pool.submitPost("http://localhost/form", "a=1&b=2");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(RequestMethod.POST, seenMethod.get());
        assertEquals("a=1&b=2", seenBody.get());
        assertEquals("created", pool.getTask(id).orElseThrow().result().body());
    }

    @Test
    void taskTransportOverridesPoolDefault() {
        ScriptedTransport poolDefault = ScriptedTransport.succeeding(Duration.ZERO);
        ScriptedTransport override = ScriptedTransport.succeeding(Duration.ZERO);
        RequestPool pool = pool(1, poolDefault);

        pool.submit(RequestTask.get("http://localhost/override").transport(override).build());
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(0, poolDefault.callCount());
        assertEquals(1, override.callCount());
    }

    // ==================== Failures & callbacks ====================

    @Test
    @DisplayName("Failing transport: task FAILED, failure callback once, success callback never")
    void failingTransportInvokesFailureCallbackOnce() {
        RequestPool pool = pool(2, ScriptedTransport.failing());
        AtomicInteger successCalls = new AtomicInteger();
        AtomicInteger failureCalls = new AtomicInteger();
        AtomicReference<RequestTask> failedTask = new AtomicReference<>();
        AtomicReference<TransportException> failure = new AtomicReference<>();

        String id = pool.submitGet("http://localhost/broken",
                task -> successCalls.incrementAndGet(),
                (task, error) -> {
                    failureCalls.incrementAndGet();
                    failedTask.set(task);
                    failure.set(error);
                });
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        RequestTask task = pool.getTask(id).orElseThrow();
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals(0, successCalls.get());
        assertEquals(1, failureCalls.get());
        assertSame(task, failedTask.get());
        assertEquals("boom from http://localhost/broken", failure.get().getMessage());
        assertEquals("boom from http://localhost/broken", task.result().errorMessage());
        assertNotNull(task.completedAt());
        assertEquals(1, pool.status().failedTasks());
    }

    @Test
    void transportExceptionBecomesFailedTaskAndPoolKeepsRunning() {
        AtomicInteger calls = new AtomicInteger();
        RequestPool pool = new RequestPool(config(1), (endpoint, method, body) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return TransportOutcome.success(TaskResult.success(200, "ok"));
        });
        pools.add(pool);
        AtomicReference<TransportException> failure = new AtomicReference<>();

        String broken = pool.submitGet("http://localhost/1", null, (task, error) -> failure.set(error));
        String fine = pool.submitGet("http://localhost/2");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(TaskStatus.FAILED, pool.getTask(broken).orElseThrow().status());
        assertTrue(pool.getTask(broken).orElseThrow().result().errorMessage().contains("connection reset"));
        assertInstanceOf(IllegalStateException.class, failure.get().getCause());
        assertEquals(TaskStatus.COMPLETED, pool.getTask(fine).orElseThrow().status());
        assertEquals(1, pool.availableSlots());
    }

    @Test
    void partialResponseIsKeptOnFailure() {
        RequestPool pool = new RequestPool(config(1), (endpoint, method, body) -> TransportOutcome.failure(
                new TransportException("HTTP 503 from " + endpoint, 503, null),
                TaskResult.success(503, "maintenance")));
        pools.add(pool);

        String id = pool.submitGet("http://localhost/down");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        TaskResult result = pool.getTask(id).orElseThrow().result();
        assertEquals(503, result.statusCode());
        assertEquals("maintenance", result.body());
        assertEquals("HTTP 503 from http://localhost/down", result.errorMessage());
    }

    @Test
    void throwingCallbackDoesNotLeakSlotOrChangeState() {
        RequestPool pool = pool(1, ScriptedTransport.succeeding(Duration.ZERO));

        String first = pool.submitGet("http://localhost/1", task -> {
            throw new IllegalStateException("callback bug");
        }, null);
        String second = pool.submitGet("http://localhost/2");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(TaskStatus.COMPLETED, pool.getTask(first).orElseThrow().status());
        assertEquals(TaskStatus.COMPLETED, pool.getTask(second).orElseThrow().status());
        assertEquals(1, pool.availableSlots());
    }

    // ==================== Completion notification ====================

    @Test
    @DisplayName("All-completed notification fires once per idle transition")
    void completionNotificationFiresOncePerIdleTransition() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO).holding();
        RequestPool pool = pool(2, transport);
        List<PoolStatus> notifications = new CopyOnWriteArrayList<>();
        pool.addListener(PoolListener.onAllCompleted(notifications::add));

        for (int i = 0; i < 4; i++) {
            pool.submitGet("http://localhost/n/" + i);
        }
        transport.release();
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(1, notifications.size());
        PoolStatus snapshot = notifications.get(0);
        assertEquals(4, snapshot.totalTasks());
        assertEquals(snapshot.totalTasks(), snapshot.finishedTasks());
        assertTrue(snapshot.isIdle());

        // next batch is a new idle transition
        pool.submitGet("http://localhost/n/late");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(2, notifications.size());
        assertEquals(5, notifications.get(1).completedTasks());
        assertEquals(DispatchState.IDLE, pool.dispatchState());
    }

    @Test
    void listenerSeesEveryTaskEvent() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));
        AtomicInteger submitted = new AtomicInteger();
        AtomicInteger started = new AtomicInteger();
        AtomicInteger finished = new AtomicInteger();
        pool.addListener(new PoolListener() {
            @Override
            public void onTaskSubmitted(RequestTask task) {
                submitted.incrementAndGet();
            }

            @Override
            public void onTaskStarted(RequestTask task) {
                started.incrementAndGet();
            }

            @Override
            public void onTaskFinished(RequestTask task) {
                finished.incrementAndGet();
            }
        });
        pool.addListener(new PoolListener() {
            @Override
            public void onTaskFinished(RequestTask task) {
                throw new IllegalStateException("listener bug");
            }
        });

        for (int i = 0; i < 3; i++) {
            pool.submitGet("http://localhost/events/" + i);
        }
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(3, submitted.get());
        assertEquals(3, started.get());
        assertEquals(3, finished.get());
    }

    @Test
    void removedListenerIsNoLongerCalled() {
        RequestPool pool = pool(1, ScriptedTransport.succeeding(Duration.ZERO));
        AtomicInteger finished = new AtomicInteger();
        PoolListener listener = new PoolListener() {
            @Override
            public void onTaskFinished(RequestTask task) {
                finished.incrementAndGet();
            }
        };
        pool.addListener(listener);

        pool.submitGet("http://localhost/before");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertEquals(1, finished.get());

        assertTrue(pool.removeListener(listener));
        assertFalse(pool.removeListener(listener));

        pool.submitGet("http://localhost/after");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertEquals(1, finished.get());
    }

    @Test
    @DisplayName("Stopping from the all-completed listener returns drained without waiting out the timeout")
    void stopFromCompletionListener() throws Exception {
        RequestPool pool = new RequestPool(config(2).withStopTimeout(Duration.ofSeconds(3)),
                ScriptedTransport.succeeding(Duration.ZERO));
        pools.add(pool);
        AtomicReference<Boolean> drained = new AtomicReference<>();
        AtomicLong elapsedMs = new AtomicLong();
        CountDownLatch stopped = new CountDownLatch(1);
        pool.addListener(PoolListener.onAllCompleted(status -> {
            long start = System.nanoTime();
            drained.set(pool.stop());
            elapsedMs.set((System.nanoTime() - start) / 1_000_000);
            stopped.countDown();
        }));

        pool.submitGet("http://localhost/only");

        assertTrue(stopped.await(5, TimeUnit.SECONDS));
        assertEquals(Boolean.TRUE, drained.get());
        assertTrue(elapsedMs.get() < 1000, "stop took " + elapsedMs.get() + "ms");
        assertEquals(DispatchState.STOPPED, pool.dispatchState());
        assertEquals(1, pool.status().completedTasks());
        assertThrows(PoolShutdownException.class, () -> pool.submitGet("http://localhost/late"));
    }

    @Test
    void awaitCompletionFromListenerReturnsAtOnce() throws Exception {
        RequestPool pool = pool(1, ScriptedTransport.succeeding(Duration.ZERO));
        CountDownLatch returned = new CountDownLatch(1);
        pool.addListener(PoolListener.onAllCompleted(status -> {
            if (pool.awaitCompletion()) {
                returned.countDown();
            }
        }));

        pool.submitGet("http://localhost/only");

        assertTrue(returned.await(5, TimeUnit.SECONDS));
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertFalse(pool.status().isRunning());
    }

    @Test
    void taskSubmittedFromListenerStartsNextRun() {
        RequestPool pool = pool(1, ScriptedTransport.succeeding(Duration.ZERO));
        List<PoolStatus> notifications = new CopyOnWriteArrayList<>();
        pool.addListener(PoolListener.onAllCompleted(status -> {
            notifications.add(status);
            if (notifications.size() == 1) {
                pool.submitGet("http://localhost/follow-up");
            }
        }));

        pool.submitGet("http://localhost/first");

        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        assertEquals(2, notifications.size());
        assertFalse(notifications.get(0).isRunning());
        assertEquals(2, pool.status().completedTasks());
        assertEquals(DispatchState.IDLE, pool.dispatchState());
    }

    @Test
    @DisplayName("Concurrent submissions start one dispatch loop per idle cycle")
    void concurrentSubmissionsLaunchSingleLoop() throws Exception {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO).holding();
        AtomicInteger loopLaunches = new AtomicInteger();
        ExecutorService dispatcher = Executors.newSingleThreadExecutor();
        ExecutorService workers = Executors.newCachedThreadPool();
        ExecutorService submitters = Executors.newFixedThreadPool(8);
        RequestPool pool = new RequestPool(config(4), transport, new InMemoryTaskRegistry(),
                loop -> {
                    loopLaunches.incrementAndGet();
                    dispatcher.execute(loop);
                },
                workers);
        pools.add(pool);

        try {
            CountDownLatch go = new CountDownLatch(1);
            List<Future<?>> submissions = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                submissions.add(submitters.submit(() -> {
                    go.await();
                    for (int i = 0; i < 5; i++) {
                        pool.submitGet("http://localhost/c/" + thread + "/" + i);
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> submission : submissions) {
                submission.get(5, TimeUnit.SECONDS);
            }
            assertEquals(1, loopLaunches.get());

            transport.release();
            assertTrue(pool.awaitCompletion(Duration.ofSeconds(10)));
            assertEquals(1, loopLaunches.get());
            assertEquals(40, pool.status().completedTasks());
            assertTrue(transport.peak.get() <= 4, "peak was " + transport.peak.get());

            // the next batch is a new idle cycle with its own loop
            pool.submitGet("http://localhost/c/next");
            assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
            assertEquals(2, loopLaunches.get());
            assertEquals(41, pool.status().completedTasks());
        } finally {
            transport.release();
            submitters.shutdownNow();
            dispatcher.shutdownNow();
            workers.shutdownNow();
        }
    }

    // ==================== Shutdown ====================

    @Test
    @DisplayName("Immediate stop before dispatch cancels all queued tasks")
    void stopNowCancelsQueuedTasks() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO);
        Queue<Runnable> neverRun = new ConcurrentLinkedQueue<>();
        RequestPool pool = new RequestPool(config(2), transport, new InMemoryTaskRegistry(),
                neverRun::add, Runnable::run);
        pools.add(pool);

        List<String> ids = List.of(
                pool.submitGet("http://localhost/1"),
                pool.submitGet("http://localhost/2"),
                pool.submitGet("http://localhost/3"));
        pool.stopNow();

        for (String id : ids) {
            RequestTask task = pool.getTask(id).orElseThrow();
            assertEquals(TaskStatus.CANCELLED, task.status());
            assertNull(task.startedAt());
            assertNotNull(task.completedAt());
            assertNull(task.result());
        }
        PoolStatus status = pool.status();
        assertEquals(3, status.cancelledTasks());
        assertEquals(0, status.completedTasks());
        assertEquals(0, status.failedTasks());
        assertFalse(status.isRunning());
        assertEquals(0, transport.callCount());
        assertEquals(DispatchState.STOPPED, pool.dispatchState());
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(1)));
    }

    @Test
    void stopNowTwiceLeavesSameState() {
        Queue<Runnable> neverRun = new ConcurrentLinkedQueue<>();
        RequestPool pool = new RequestPool(config(2), ScriptedTransport.succeeding(Duration.ZERO),
                new InMemoryTaskRegistry(), neverRun::add, Runnable::run);
        pools.add(pool);
        pool.submitGet("http://localhost/1");
        pool.submitGet("http://localhost/2");

        pool.stopNow();
        PoolStatus once = pool.status();
        DispatchState stateOnce = pool.dispatchState();

        pool.stopNow();

        assertEquals(once, pool.status());
        assertEquals(stateOnce, pool.dispatchState());
        assertThrows(PoolShutdownException.class, () -> pool.submitGet("http://localhost/3"));
    }

    @Test
    void stopNowLetsRunningTaskFinish() throws Exception {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO).holding();
        RequestPool pool = pool(1, transport);

        String running = pool.submitGet("http://localhost/1");
        String queued1 = pool.submitGet("http://localhost/2");
        String queued2 = pool.submitGet("http://localhost/3");
        assertTrue(transport.firstCall.await(5, TimeUnit.SECONDS));

        pool.stopNow();
        assertEquals(TaskStatus.RUNNING, pool.getTask(running).orElseThrow().status());

        transport.release();
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        assertEquals(TaskStatus.COMPLETED, pool.getTask(running).orElseThrow().status());
        assertEquals(TaskStatus.CANCELLED, pool.getTask(queued1).orElseThrow().status());
        assertEquals(TaskStatus.CANCELLED, pool.getTask(queued2).orElseThrow().status());
        assertEquals(1, transport.callCount());
        assertEquals(1, pool.availableSlots());
    }

    @Test
    @DisplayName("A task handed to a worker but not yet RUNNING is cancelled by stopNow")
    void stopNowCancelsHandedOffTask() throws Exception {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO);
        Queue<Runnable> handedOff = new ConcurrentLinkedQueue<>();
        ExecutorService dispatcher = Executors.newSingleThreadExecutor();
        try {
            RequestPool pool = new RequestPool(config(1), transport, new InMemoryTaskRegistry(),
                    dispatcher, handedOff::add);
            pools.add(pool);

            String id = pool.submitGet("http://localhost/handoff");
            long deadline = System.currentTimeMillis() + 5000;
            while (handedOff.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(1, handedOff.size());
            assertEquals(0, pool.availableSlots());

            pool.stopNow();
            handedOff.poll().run();

            assertEquals(TaskStatus.CANCELLED, pool.getTask(id).orElseThrow().status());
            assertEquals(0, transport.callCount());
            assertEquals(1, pool.availableSlots());
            assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
        } finally {
            dispatcher.shutdownNow();
        }
    }

    @Test
    void gracefulStopDrainsQueueThenRejects() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ofMillis(20));
        RequestPool pool = pool(2, transport);
        for (int i = 0; i < 4; i++) {
            pool.submitGet("http://localhost/drain/" + i);
        }

        assertTrue(pool.stop(Duration.ofSeconds(5)));

        assertEquals(4, pool.status().completedTasks());
        assertEquals(DispatchState.STOPPED, pool.dispatchState());
        assertFalse(pool.isAcceptingTasks());
        assertThrows(PoolShutdownException.class, () -> pool.submitGet("http://localhost/late"));
    }

    @Test
    void gracefulStopTimeoutCancelsWhatIsStillQueued() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO).holding();
        RequestPool pool = pool(1, transport);
        try {
            String first = pool.submitGet("http://localhost/1");
            String second = pool.submitGet("http://localhost/2");
            String third = pool.submitGet("http://localhost/3");

            assertFalse(pool.stop(Duration.ofMillis(100)));

            assertEquals(TaskStatus.CANCELLED, pool.getTask(second).orElseThrow().status());
            assertEquals(TaskStatus.CANCELLED, pool.getTask(third).orElseThrow().status());

            transport.release();
            assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
            assertEquals(TaskStatus.COMPLETED, pool.getTask(first).orElseThrow().status());

            PoolStatus status = pool.status();
            assertEquals(status.totalTasks(), status.finishedTasks());
        } finally {
            transport.release();
        }
    }

    @Test
    void awaitTimeoutHasNoSideEffects() {
        ScriptedTransport transport = ScriptedTransport.succeeding(Duration.ZERO).holding();
        RequestPool pool = pool(1, transport);
        try {
            String first = pool.submitGet("http://localhost/1");
            String second = pool.submitGet("http://localhost/2");

            assertFalse(pool.awaitCompletion(Duration.ofMillis(50)));
            assertEquals(TaskStatus.PENDING, pool.getTask(second).orElseThrow().status());

            transport.release();
            assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));
            assertEquals(TaskStatus.COMPLETED, pool.getTask(first).orElseThrow().status());
            assertEquals(TaskStatus.COMPLETED, pool.getTask(second).orElseThrow().status());
        } finally {
            transport.release();
        }
    }

    @Test
    void closeIsIdempotent() {
        RequestPool pool = pool(2, ScriptedTransport.succeeding(Duration.ZERO));
        pool.submitGet("http://localhost/1");
        assertTrue(pool.awaitCompletion(Duration.ofSeconds(5)));

        pool.close();
        assertDoesNotThrow(pool::close);

        assertEquals(DispatchState.STOPPED, pool.dispatchState());
        assertThrows(PoolShutdownException.class, () -> pool.submitGet("http://localhost/2"));
        assertEquals(1, pool.listTasks().size());
    }
}
