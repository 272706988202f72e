package reqpool.pool.service;

import reqpool.pool.model.RequestTask;
import reqpool.pool.model.TaskResult;
import reqpool.pool.transport.Transport;
import reqpool.pool.transport.TransportException;
import reqpool.pool.transport.TransportOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Executes one admitted task on the calling worker thread.
 *
 * The slot the task holds is not touched here; releasing it belongs to the dispatch side.
 * Nothing thrown by the transport, a callback or a listener escapes {@link #run}.
 */
final class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final Transport defaultTransport;
    private final PoolCounters counters;
    private final PoolListeners listeners;
    private final BooleanSupplier stoppedNow;

    TaskRunner(Transport defaultTransport, PoolCounters counters, PoolListeners listeners,
            BooleanSupplier stoppedNow) {
        this.defaultTransport = defaultTransport;
        this.counters = counters;
        this.listeners = listeners;
        this.stoppedNow = stoppedNow;
    }

    void run(RequestTask task) {
        // popped but not started when an immediate stop landed
        if (stoppedNow.getAsBoolean()) {
            cancel(task);
            return;
        }
        if (!task.markRunning()) {
            log.debug("Task {} is {}, not starting it", task.id(), task.status());
            return;
        }

        counters.taskStarted();
        try {
            log.debug("Task {} started: {} {}", task.id(), task.method(), task.endpoint());
            listeners.fire("taskStarted", l -> l.onTaskStarted(task));

            TransportOutcome outcome = execute(task);
            if (outcome.isSuccess()) {
                complete(task, outcome.result());
            } else {
                fail(task, outcome);
            }
        } finally {
            counters.taskLeftRunning();
        }
    }

    /**
     * PENDING → CANCELLED, counted once.
     */
    void cancel(RequestTask task) {
        if (task.markCancelled()) {
            counters.taskCancelled();
            log.debug("Task {} cancelled", task.id());
            listeners.fire("taskFinished", l -> l.onTaskFinished(task));
        }
    }

    private TransportOutcome execute(RequestTask task) {
        Transport transport = task.transport() != null ? task.transport() : defaultTransport;
        try {
            TransportOutcome outcome = transport.execute(task.endpoint(), task.method(), task.body());
            if (outcome == null) {
                return TransportOutcome.failure(new TransportException("Transport returned no outcome"));
            }
            return outcome;
        } catch (RuntimeException e) {
            return TransportOutcome.failure(new TransportException("Transport error: " + e.getMessage(), e));
        }
    }

    private void complete(RequestTask task, TaskResult result) {
        if (!task.markCompleted(result)) {
            log.warn("Task {} could not be completed from state {}", task.id(), task.status());
            return;
        }
        counters.taskCompleted();
        log.debug("Task {} completed with status {}", task.id(), result.statusCode());

        try {
            task.fireSuccess();
        } catch (RuntimeException e) {
            log.warn("Success callback of task {} failed: {}", task.id(), e.getMessage(), e);
        }
        listeners.fire("taskFinished", l -> l.onTaskFinished(task));
    }

    private void fail(RequestTask task, TransportOutcome outcome) {
        TransportException error = outcome.error();
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        TaskResult partial = outcome.result();
        TaskResult result = partial == null ? TaskResult.error(message)
                : partial.hasError() ? partial : partial.withError(message);

        if (!task.markFailed(result)) {
            log.warn("Task {} could not be failed from state {}", task.id(), task.status());
            return;
        }
        counters.taskFailed();
        log.debug("Task {} failed: {}", task.id(), message);

        try {
            task.fireFailure(error);
        } catch (RuntimeException e) {
            log.warn("Failure callback of task {} failed: {}", task.id(), e.getMessage(), e);
        }
        listeners.fire("taskFinished", l -> l.onTaskFinished(task));
    }
}
