package reqpool.pool.exception;

/**
 * Thrown when a submitted task is rejected before it reaches the registry:
 * a null task or a blank endpoint.
 */
public class TaskValidationException extends IllegalArgumentException {

    public TaskValidationException(String message) {
        super(message);
    }
}
