package reqpool.pool.transport;

import reqpool.pool.model.TaskResult;

import java.util.Objects;

/**
 * Result-or-error returned by a {@link Transport}.
 * A failure may still carry the partial response (e.g. a non-2xx body).
 */
public final class TransportOutcome {

    private final TaskResult result;
    private final TransportException error;

    private TransportOutcome(TaskResult result, TransportException error) {
        this.result = result;
        this.error = error;
    }

    public static TransportOutcome success(TaskResult result) {
        return new TransportOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static TransportOutcome failure(TransportException error) {
        return new TransportOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public static TransportOutcome failure(TransportException error, TaskResult partial) {
        return new TransportOutcome(partial, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Response payload; null for a failure without a response. */
    public TaskResult result() {
        return result;
    }

    /** Failure cause; null on success. */
    public TransportException error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "TransportOutcome{success, " + result + '}'
                : "TransportOutcome{failure, error='" + error.getMessage() + "'}";
    }
}
