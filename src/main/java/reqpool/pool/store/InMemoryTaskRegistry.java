package reqpool.pool.store;

import reqpool.pool.exception.DuplicateTaskException;
import reqpool.pool.model.RequestTask;
import reqpool.pool.repository.TaskRegistry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link TaskRegistry} backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private final ConcurrentMap<String, RequestTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void register(RequestTask task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new DuplicateTaskException(task.id());
        }
    }

    @Override
    public Optional<RequestTask> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public List<RequestTask> findAll() {
        return List.copyOf(tasks.values());
    }

    @Override
    public int size() {
        return tasks.size();
    }
}
