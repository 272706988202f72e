package reqpool.pool.exception;

/**
 * Thrown when a task is submitted with an identifier that is already registered.
 */
public class DuplicateTaskException extends IllegalStateException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already registered: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
