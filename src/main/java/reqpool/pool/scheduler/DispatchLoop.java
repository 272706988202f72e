package reqpool.pool.scheduler;

import reqpool.pool.model.RequestTask;
import reqpool.pool.scheduler.ConcurrencyGate.Permit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Moves queued tasks into execution under the gate's limit.
 *
 * One pass of the loop does one of three things:
 * - queue empty, nothing in flight: ask the host to go idle, exit if it did
 * - queue empty, executions in flight: wait for progress, at most one poll interval
 * - queue non-empty: acquire a slot, pop the oldest task and launch it
 *
 * A task counts as in flight from slot acquisition until slot release, so the host never
 * goes idle while a launched task has not yet reached RUNNING.
 * Cancellation interrupts either wait and ends the loop without going idle.
 */
public class DispatchLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    /**
     * Pool-side operations the loop relies on.
     */
    public interface Host {

        boolean hasQueued();

        /** Pop the oldest queued task, or null if the queue was drained meanwhile. */
        RequestTask poll();

        int inFlight();

        void beginFlight();

        void endFlight();

        /**
         * Run the task on its own thread. The host owns the permit from here on and must
         * close it and call {@link #endFlight()} once the execution is over.
         */
        void launch(RequestTask task, Permit permit);

        /** Block until an execution finishes, new work arrives or the timeout expires. */
        void awaitProgress(Duration timeout) throws InterruptedException;

        /**
         * Called when the queue is empty and nothing is in flight.
         *
         * @return true if the host went idle and the loop should exit, false if work arrived
         */
        boolean tryGoIdle();

        /** Always called last, from the loop thread. */
        void loopExited(boolean wentIdle);
    }

    private final Host host;
    private final ConcurrencyGate gate;
    private final CancellationSignal signal;
    private final Duration pollInterval;

    public DispatchLoop(Host host, ConcurrencyGate gate, CancellationSignal signal, Duration pollInterval) {
        this.host = host;
        this.gate = gate;
        this.signal = signal;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        signal.bind(Thread.currentThread());
        boolean wentIdle = false;
        log.debug("Dispatch loop started");
        try {
            while (!signal.isCancelled()) {
                if (!host.hasQueued()) {
                    if (host.inFlight() == 0) {
                        if (host.tryGoIdle()) {
                            wentIdle = true;
                            return;
                        }
                        continue;
                    }
                    host.awaitProgress(pollInterval);
                    continue;
                }

                Permit permit = gate.acquire();
                host.beginFlight();
                if (signal.isCancelled()) {
                    permit.close();
                    host.endFlight();
                    break;
                }

                RequestTask task = host.poll();
                if (task == null) {
                    // raced with a drain; give the slot back and look again
                    permit.close();
                    host.endFlight();
                    continue;
                }
                host.launch(task, permit);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Dispatch loop interrupted");
        } catch (RuntimeException e) {
            log.error("Dispatch loop failed", e);
        } finally {
            signal.unbind();
            host.loopExited(wentIdle);
        }
    }
}
