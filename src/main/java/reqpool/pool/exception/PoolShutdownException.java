package reqpool.pool.exception;

/**
 * Thrown when work is submitted to a pool that has been stopped or closed.
 */
public class PoolShutdownException extends IllegalStateException {

    public PoolShutdownException(String message) {
        super(message);
    }
}
