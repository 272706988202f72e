package reqpool.pool.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registered listeners. A failing listener is logged and does not stop the others.
 */
final class PoolListeners {

    private static final Logger log = LoggerFactory.getLogger(PoolListeners.class);

    private final List<PoolListener> listeners = new CopyOnWriteArrayList<>();

    void add(PoolListener listener) {
        listeners.add(listener);
    }

    boolean remove(PoolListener listener) {
        return listeners.remove(listener);
    }

    void fire(String event, Consumer<PoolListener> action) {
        for (PoolListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", listener.getClass().getName(), event, e.getMessage(), e);
            }
        }
    }
}
