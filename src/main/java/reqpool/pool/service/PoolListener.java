package reqpool.pool.service;

import reqpool.pool.model.PoolStatus;
import reqpool.pool.model.RequestTask;

import java.util.function.Consumer;

/**
 * Receives pool events. All methods are optional.
 *
 * Per-task events arrive on the thread that caused them: the submitting thread for
 * {@link #onTaskSubmitted}, the worker thread for start and finish, and the thread that
 * cancelled the task for a cancellation. Exceptions thrown by a listener are logged and
 * otherwise ignored.
 */
public interface PoolListener {

    /**
     * The queue is empty and nothing is in flight. Fired once per idle transition,
     * from the dispatch thread, with the counters at that moment.
     *
     * The pool is already idle when this runs, so the listener may stop or close it.
     * A task submitted from here starts the next dispatch run.
     */
    default void onAllTasksCompleted(PoolStatus status) {
    }

    default void onTaskSubmitted(RequestTask task) {
    }

    default void onTaskStarted(RequestTask task) {
    }

    /** The task reached COMPLETED, FAILED or CANCELLED. */
    default void onTaskFinished(RequestTask task) {
    }

    /**
     * Listener that only cares about idle transitions.
     */
    static PoolListener onAllCompleted(Consumer<PoolStatus> handler) {
        return new PoolListener() {
            @Override
            public void onAllTasksCompleted(PoolStatus status) {
                handler.accept(status);
            }
        };
    }
}
