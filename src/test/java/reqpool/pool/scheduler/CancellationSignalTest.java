package reqpool.pool.scheduler;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void cancelInterruptsBoundThread() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch bound = new CountDownLatch(1);
        CountDownLatch woke = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            signal.bind(Thread.currentThread());
            bound.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                woke.countDown();
            } finally {
                signal.unbind();
            }
        });
        worker.start();
        assertTrue(bound.await(2, TimeUnit.SECONDS));

        signal.cancel();

        assertTrue(woke.await(2, TimeUnit.SECONDS));
        assertTrue(signal.isCancelled());
    }

    @Test
    void bindingAfterCancelInterruptsAtOnce() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        CountDownLatch sawInterrupt = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            signal.bind(Thread.currentThread());
            if (Thread.currentThread().isInterrupted()) {
                sawInterrupt.countDown();
            }
            signal.unbind();
        });
        worker.start();

        assertTrue(sawInterrupt.await(2, TimeUnit.SECONDS));
    }

    @Test
    void cancelWithoutBoundThreadOnlySetsFlag() {
        CancellationSignal signal = new CancellationSignal();
        assertFalse(signal.isCancelled());

        signal.cancel();
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void cancelFromBoundThreadDoesNotInterruptItself() {
        CancellationSignal signal = new CancellationSignal();
        signal.bind(Thread.currentThread());
        try {
            signal.cancel();

            assertTrue(signal.isCancelled());
            assertFalse(Thread.currentThread().isInterrupted());
        } finally {
            signal.unbind();
        }
    }

    @Test
    void unbindFromOtherThreadKeepsBinding() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch bound = new CountDownLatch(1);
        CountDownLatch woke = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            signal.bind(Thread.currentThread());
            bound.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                woke.countDown();
            } finally {
                signal.unbind();
            }
        });
        worker.start();
        assertTrue(bound.await(2, TimeUnit.SECONDS));

        signal.unbind();
        signal.cancel();

        assertTrue(woke.await(2, TimeUnit.SECONDS));
    }
}
