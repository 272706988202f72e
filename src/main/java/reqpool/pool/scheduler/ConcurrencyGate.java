package reqpool.pool.scheduler;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counting admission control for task executions.
 *
 * Slots are handed out as {@link Permit}s. A permit releases its slot exactly once,
 * however many times it is closed, so holders can use try-with-resources on every path.
 */
public class ConcurrencyGate {

    private final Semaphore semaphore;
    private final int maxPermits;

    public ConcurrencyGate(int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("maxPermits must be positive, got " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.semaphore = new Semaphore(maxPermits, true);
    }

    /**
     * Block until a slot is free.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        return new Permit(semaphore);
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int maxPermits() {
        return maxPermits;
    }

    /**
     * One acquired slot.
     */
    public static final class Permit implements AutoCloseable {
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
