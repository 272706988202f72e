package reqpool.pool.model;

/**
 * State of the dispatch loop.
 */
public enum DispatchState {
    /** No loop running; the next submission starts one */
    IDLE,
    /** Loop is pulling tasks from the queue and launching executions */
    DRAINING,
    /** Pool was stopped; no further dispatch */
    STOPPED
}
