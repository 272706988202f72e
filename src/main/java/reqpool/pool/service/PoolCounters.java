package reqpool.pool.service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Aggregate task counters. Each counter is updated atomically on its own.
 */
final class PoolCounters {

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger cancelled = new AtomicInteger();

    void taskSubmitted() {
        total.incrementAndGet();
    }

    void taskStarted() {
        running.incrementAndGet();
    }

    void taskLeftRunning() {
        running.decrementAndGet();
    }

    void taskCompleted() {
        completed.incrementAndGet();
    }

    void taskFailed() {
        failed.incrementAndGet();
    }

    void taskCancelled() {
        cancelled.incrementAndGet();
    }

    int total() {
        return total.get();
    }

    int running() {
        return running.get();
    }

    int completed() {
        return completed.get();
    }

    int failed() {
        return failed.get();
    }

    int cancelled() {
        return cancelled.get();
    }
}
