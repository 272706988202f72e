package reqpool.pool.model;

/**
 * Point-in-time snapshot of pool counters.
 * Counters are read independently, so the snapshot is approximate while tasks are being
 * dispatched and exact once the pool is idle.
 *
 * @param totalTasks     tasks accepted since the pool was created
 * @param pendingTasks   tasks waiting in the admission queue
 * @param runningTasks   tasks whose request is in flight
 * @param completedTasks tasks that finished successfully
 * @param failedTasks    tasks that finished with an error
 * @param cancelledTasks tasks cancelled while still queued
 * @param isRunning      whether the dispatch loop is active
 */
public record PoolStatus(
        int totalTasks,
        int pendingTasks,
        int runningTasks,
        int completedTasks,
        int failedTasks,
        int cancelledTasks,
        boolean isRunning) {

    /** Tasks in a terminal state. */
    public int finishedTasks() {
        return completedTasks + failedTasks + cancelledTasks;
    }

    /** No queued or running work. */
    public boolean isIdle() {
        return pendingTasks == 0 && runningTasks == 0;
    }
}
