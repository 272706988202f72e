package reqpool.pool.scheduler;

/**
 * One-shot cancellation flag shared by a pool and its dispatch loop.
 *
 * The loop binds its thread while it runs; {@link #cancel()} interrupts that thread so a
 * loop blocked on the gate or on the idle wait wakes up at once.
 */
public class CancellationSignal {

    private volatile boolean cancelled = false;
    private Thread boundThread;

    public synchronized void bind(Thread thread) {
        this.boundThread = thread;
        if (cancelled) {
            thread.interrupt();
        }
    }

    /** Clears the binding if it belongs to the calling thread. */
    public synchronized void unbind() {
        if (boundThread == Thread.currentThread()) {
            this.boundThread = null;
        }
    }

    /**
     * Raise the flag. Only the first call interrupts the bound thread, and never when the
     * bound thread is the caller: the loop re-checks the flag before every wait.
     */
    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (boundThread != null && boundThread != Thread.currentThread()) {
            boundThread.interrupt();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
