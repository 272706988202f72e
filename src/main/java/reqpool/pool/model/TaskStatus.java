package reqpool.pool.model;

/**
 * Request task lifecycle status.
 */
public enum TaskStatus {
    /** Task submitted, waiting in the admission queue */
    PENDING,
    /** Task holds an execution slot and its request is in flight */
    RUNNING,
    /** Request finished successfully */
    COMPLETED,
    /** Request failed; the error message is kept in the result */
    FAILED,
    /** Task was still queued when the pool was stopped */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
