package reqpool.pool.repository;

import reqpool.pool.exception.DuplicateTaskException;
import reqpool.pool.model.RequestTask;

import java.util.List;
import java.util.Optional;

/**
 * Registry of every task submitted to a pool, keyed by task id.
 * Entries are never removed while the pool is alive.
 */
public interface TaskRegistry {

    /**
     * Register a new task.
     *
     * @throws DuplicateTaskException if a task with the same id is already registered
     */
    void register(RequestTask task);

    /**
     * Find a task by ID.
     */
    Optional<RequestTask> findById(String id);

    /**
     * Snapshot of all registered tasks, in no particular order.
     */
    List<RequestTask> findAll();

    int size();
}
