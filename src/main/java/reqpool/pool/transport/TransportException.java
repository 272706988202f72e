package reqpool.pool.transport;

/**
 * Describes why a request produced no successful response.
 * Carried inside a failed {@link TransportOutcome} and handed to the task's failure callback.
 */
public class TransportException extends RuntimeException {

    private final int statusCode; // 0 when no response was received

    public TransportException(String message) {
        this(message, 0, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode > 0;
    }
}
