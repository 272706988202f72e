package reqpool.pool.service;

import reqpool.pool.config.PoolConfig;
import reqpool.pool.exception.PoolShutdownException;
import reqpool.pool.exception.TaskValidationException;
import reqpool.pool.model.DispatchState;
import reqpool.pool.model.PoolStatus;
import reqpool.pool.model.RequestTask;
import reqpool.pool.model.TaskStatus;
import reqpool.pool.repository.TaskRegistry;
import reqpool.pool.scheduler.CancellationSignal;
import reqpool.pool.scheduler.ConcurrencyGate;
import reqpool.pool.scheduler.ConcurrencyGate.Permit;
import reqpool.pool.scheduler.DispatchLoop;
import reqpool.pool.store.InMemoryTaskRegistry;
import reqpool.pool.transport.HttpClientTransport;
import reqpool.pool.transport.Transport;
import reqpool.pool.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Bounded-concurrency pool for outbound requests.
 *
 * Submitted tasks are registered, queued in FIFO order and dispatched by a single
 * background loop that never runs more than {@code maxConcurrency} of them at once.
 * The loop starts lazily on the first submission, goes idle (firing
 * {@link PoolListener#onAllTasksCompleted}) once the queue is empty and nothing is in flight,
 * and is restarted by the next submission.
 *
 * Usage:
 *
 * <pre>
 * try (RequestPool pool = new RequestPool(PoolConfig.defaults().withMaxConcurrency(4))) {
 *     pool.submitGet("https://example.org/a");
 *     pool.submitGet("https://example.org/b");
 *     pool.awaitCompletion(Duration.ofMinutes(1));
 * }
 * </pre>
 *
 * Two ways to stop: {@link #stop()} refuses new work and waits for the queue to drain,
 * {@link #stopNow()} cancels everything still queued. Neither interrupts a running request.
 */
public class RequestPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestPool.class);
    private static final Duration LOOP_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final PoolConfig config;
    private final TaskRegistry registry;
    private final Queue<RequestTask> queue = new ConcurrentLinkedQueue<>();
    private final ConcurrencyGate gate;
    private final CancellationSignal signal = new CancellationSignal();
    private final PoolCounters counters = new PoolCounters();
    private final PoolListeners listeners = new PoolListeners();
    private final TaskRunner runner;
    private final AtomicInteger inFlight = new AtomicInteger();

    private final Executor dispatcher;
    private final Executor workers;

    // guards loop start/idle and backs every wait
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private volatile boolean running = false;
    private volatile boolean acceptingTasks = true;
    private volatile DispatchState state = DispatchState.IDLE;
    private volatile CompletableFuture<Void> loopDone;
    // dispatch thread while it runs the all-completed listeners
    private volatile Thread notifier;
    private final AtomicBoolean stoppedNow = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a pool that sends requests through the JDK HTTP client.
     */
    public RequestPool(PoolConfig config) {
        this(config, new HttpClientTransport(config));
    }

    /**
     * Create a pool with the given default transport.
     *
     * @throws IllegalArgumentException if the configured concurrency is not positive
     */
    public RequestPool(PoolConfig config, Transport transport) {
        this(config, transport, new InMemoryTaskRegistry(),
                Executors.newSingleThreadExecutor(daemonThreads("reqpool-dispatcher")),
                Executors.newCachedThreadPool(daemonThreads("reqpool-worker")));
    }

    RequestPool(PoolConfig config, Transport transport, TaskRegistry registry, Executor dispatcher,
            Executor workers) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(transport, "transport");
        if (config.maxConcurrency() <= 0) {
            throw new IllegalArgumentException(
                    "maxConcurrency must be positive, got " + config.maxConcurrency());
        }
        this.config = config;
        this.registry = registry;
        this.gate = new ConcurrencyGate(config.maxConcurrency());
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.runner = new TaskRunner(transport, counters, listeners, stoppedNow::get);

        log.info("Request pool created: {}", config);
    }

    // ========== Submission ==========

    /**
     * Register and enqueue a task, starting the dispatch loop if it is idle.
     *
     * @return the task id
     * @throws TaskValidationException if the task is null, has a blank endpoint or was
     *                                 already submitted somewhere
     * @throws PoolShutdownException   if the pool has been stopped
     * @throws reqpool.pool.exception.DuplicateTaskException if the id is already registered
     */
    public String submit(RequestTask task) {
        if (task == null) {
            throw new TaskValidationException("task must not be null");
        }
        if (task.endpoint() == null || task.endpoint().isBlank()) {
            throw new TaskValidationException("endpoint must not be blank (task " + task.id() + ")");
        }
        if (task.status() != TaskStatus.PENDING) {
            throw new TaskValidationException("task " + task.id() + " is already " + task.status());
        }
        if (!acceptingTasks) {
            throw new PoolShutdownException("pool is stopped, task " + task.id() + " rejected");
        }

        registry.register(task);
        counters.taskSubmitted();
        queue.add(task);
        log.debug("Task {} submitted: {} {}", task.id(), task.method(), task.endpoint());
        listeners.fire("taskSubmitted", l -> l.onTaskSubmitted(task));

        // a stop may have drained the queue between the check above and the add
        if (!acceptingTasks && queue.remove(task)) {
            runner.cancel(task);
            return task.id();
        }

        ensureLoopRunning();
        return task.id();
    }

    public String submitGet(String endpoint) {
        return submit(RequestTask.get(endpoint).build());
    }

    public String submitGet(String endpoint, Consumer<RequestTask> onSuccess,
            BiConsumer<RequestTask, TransportException> onFailure) {
        return submit(RequestTask.get(endpoint)
                .onSuccess(onSuccess)
                .onFailure(onFailure)
                .build());
    }

    public String submitPost(String endpoint, String body) {
        return submit(RequestTask.post(endpoint, body).build());
    }

    public String submitPost(String endpoint, String body, Consumer<RequestTask> onSuccess,
            BiConsumer<RequestTask, TransportException> onFailure) {
        return submit(RequestTask.post(endpoint, body)
                .onSuccess(onSuccess)
                .onFailure(onFailure)
                .build());
    }

    /**
     * Submit tasks one by one in iteration order. Not atomic: if an element is rejected
     * the exception propagates and the elements before it stay submitted.
     */
    public List<String> submitAll(Collection<RequestTask> tasks) {
        if (tasks == null) {
            throw new TaskValidationException("tasks must not be null");
        }
        List<String> ids = new ArrayList<>(tasks.size());
        for (RequestTask task : tasks) {
            ids.add(submit(task));
        }
        return ids;
    }

    private void ensureLoopRunning() {
        lock.lock();
        try {
            if (signal.isCancelled()) {
                return;
            }
            if (running) {
                changed.signalAll();
                return;
            }
            running = true;
            state = DispatchState.DRAINING;
            CompletableFuture<Void> done = new CompletableFuture<>();
            loopDone = done;
            log.info("Dispatch loop starting, {} task(s) queued", queue.size());
            dispatcher.execute(new DispatchLoop(new Host(done), gate, signal, config.idlePollInterval()));
        } catch (RejectedExecutionException e) {
            running = false;
            state = DispatchState.STOPPED;
            throw new PoolShutdownException("pool is closed, dispatcher rejected the loop");
        } finally {
            lock.unlock();
        }
    }

    // ========== Status & query ==========

    /**
     * Counter snapshot. Approximate while tasks are being dispatched, exact once idle.
     */
    public PoolStatus status() {
        return snapshot(running);
    }

    private PoolStatus snapshot(boolean isRunning) {
        return new PoolStatus(
                counters.total(),
                queue.size(),
                counters.running(),
                counters.completed(),
                counters.failed(),
                counters.cancelled(),
                isRunning);
    }

    public Optional<RequestTask> getTask(String id) {
        return registry.findById(id);
    }

    public List<RequestTask> listTasks() {
        return registry.findAll();
    }

    public DispatchState dispatchState() {
        return state;
    }

    public int maxConcurrency() {
        return gate.maxPermits();
    }

    public int availableSlots() {
        return gate.availablePermits();
    }

    public boolean isAcceptingTasks() {
        return acceptingTasks;
    }

    public void addListener(PoolListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(PoolListener listener) {
        return listeners.remove(listener);
    }

    // ========== Waiting ==========

    /**
     * Block until the queue is empty, nothing is in flight and the loop is idle, with the
     * all-completed listeners done. Called from such a listener, it returns at once.
     * Returns false if the calling thread is interrupted, with the interrupt flag restored.
     */
    public boolean awaitCompletion() {
        lock.lock();
        try {
            while (!isQuiescent()) {
                changed.await();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #awaitCompletion()}, bounded by a timeout.
     *
     * @return true if the pool became idle, false on timeout. A timeout cancels nothing.
     */
    public boolean awaitCompletion(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!isQuiescent()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private boolean isQuiescent() {
        Thread notifying = notifier;
        return queue.isEmpty() && inFlight.get() == 0 && !running
                && (notifying == null || notifying == Thread.currentThread());
    }

    // ========== Shutdown ==========

    /**
     * Graceful stop with the configured stop timeout.
     */
    public boolean stop() {
        return stop(config.stopTimeout());
    }

    /**
     * Refuse new submissions, wait for queued and running tasks to finish, then end the
     * dispatch loop. Tasks still queued when the timeout expires are cancelled.
     *
     * @return true if everything finished before the timeout
     */
    public boolean stop(Duration timeout) {
        acceptingTasks = false;
        log.info("Stopping request pool, waiting up to {}ms for {} queued task(s)",
                timeout.toMillis(), queue.size());

        boolean drained = awaitCompletion(timeout);
        if (!drained) {
            int cancelled = cancelQueued();
            log.warn("Pool did not drain within {}ms, {} queued task(s) cancelled",
                    timeout.toMillis(), cancelled);
        }

        lock.lock();
        try {
            running = false;
            state = DispatchState.STOPPED;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        signal.cancel();
        joinLoop();

        log.info("Request pool stopped: {}", status());
        return drained;
    }

    /**
     * Stop dispatching at once and cancel every queued task. Tasks already running finish
     * normally. Calling it again has no effect.
     */
    public void stopNow() {
        if (!stoppedNow.compareAndSet(false, true)) {
            return;
        }
        acceptingTasks = false;

        lock.lock();
        try {
            running = false;
            state = DispatchState.STOPPED;
        } finally {
            lock.unlock();
        }
        signal.cancel();

        int cancelled = cancelQueued();

        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Request pool stopped immediately, {} queued task(s) cancelled", cancelled);
    }

    /**
     * {@link #stopNow()} plus executor shutdown. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopNow();
        if (dispatcher instanceof ExecutorService executor) {
            executor.shutdown();
        }
        if (workers instanceof ExecutorService executor) {
            executor.shutdown();
        }
        log.info("Request pool closed");
    }

    private int cancelQueued() {
        int count = 0;
        RequestTask task;
        while ((task = queue.poll()) != null) {
            if (task.status() == TaskStatus.PENDING) {
                runner.cancel(task);
                count++;
            }
        }
        return count;
    }

    private void joinLoop() {
        CompletableFuture<Void> done = loopDone;
        // a listener stopping the pool runs on the loop thread, which exits right after it
        if (done == null || Thread.currentThread() == notifier) {
            return;
        }
        try {
            done.get(LOOP_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatch loop did not end within {}ms", LOOP_JOIN_TIMEOUT.toMillis());
        } catch (ExecutionException e) {
            log.error("Dispatch loop ended with error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void signalChanged() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * The pool side of one dispatch loop run.
     */
    private final class Host implements DispatchLoop.Host {

        private final CompletableFuture<Void> done;

        Host(CompletableFuture<Void> done) {
            this.done = done;
        }

        @Override
        public boolean hasQueued() {
            return !queue.isEmpty();
        }

        @Override
        public RequestTask poll() {
            return queue.poll();
        }

        @Override
        public int inFlight() {
            return inFlight.get();
        }

        @Override
        public void beginFlight() {
            inFlight.incrementAndGet();
        }

        @Override
        public void endFlight() {
            inFlight.decrementAndGet();
            signalChanged();
        }

        @Override
        public void launch(RequestTask task, Permit permit) {
            try {
                workers.execute(() -> {
                    try (permit) {
                        runner.run(task);
                    } finally {
                        endFlight();
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Worker rejected task {}, cancelling it", task.id());
                permit.close();
                runner.cancel(task);
                endFlight();
            }
        }

        @Override
        public void awaitProgress(Duration timeout) throws InterruptedException {
            lock.lock();
            try {
                if (queue.isEmpty() && inFlight.get() > 0) {
                    changed.awaitNanos(timeout.toNanos());
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean tryGoIdle() {
            lock.lock();
            try {
                if (!queue.isEmpty() || inFlight.get() > 0) {
                    return false;
                }
                running = false;
                if (state != DispatchState.STOPPED) {
                    state = DispatchState.IDLE;
                }
                notifier = Thread.currentThread();
            } finally {
                lock.unlock();
            }

            PoolStatus snapshot = snapshot(false);
            try {
                listeners.fire("allTasksCompleted", l -> l.onAllTasksCompleted(snapshot));
            } finally {
                lock.lock();
                try {
                    notifier = null;
                    changed.signalAll();
                } finally {
                    lock.unlock();
                }
            }
            log.info("All tasks completed: {}", snapshot);
            return true;
        }

        @Override
        public void loopExited(boolean wentIdle) {
            if (!wentIdle) {
                lock.lock();
                try {
                    running = false;
                    state = signal.isCancelled() ? DispatchState.STOPPED : DispatchState.IDLE;
                    changed.signalAll();
                } finally {
                    lock.unlock();
                }
                log.info("Dispatch loop ended, state {}", state);
            }
            done.complete(null);
        }
    }
}
