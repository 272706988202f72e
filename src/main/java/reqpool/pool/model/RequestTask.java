package reqpool.pool.model;

import reqpool.pool.transport.Transport;
import reqpool.pool.transport.TransportException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A single outbound request submitted to the pool.
 *
 * Descriptor fields (endpoint, method, body, callbacks) are fixed at construction.
 * Lifecycle fields (status, timestamps, result) are owned by the pool once the task is
 * submitted; callers read them for polling but must not drive transitions themselves.
 *
 * Transitions are compare-and-set, so a terminal state is never left:
 * PENDING → RUNNING → COMPLETED | FAILED, or PENDING → CANCELLED.
 */
public final class RequestTask {
    private final String id;
    private final String name;
    private final String endpoint;
    private final RequestMethod method;
    private final String body; // POST only
    private final Transport transport; // null → pool default
    private final Consumer<RequestTask> onSuccess;
    private final BiConsumer<RequestTask, TransportException> onFailure;
    private final Instant createdAt;

    private final AtomicReference<TaskStatus> status = new AtomicReference<>(TaskStatus.PENDING);
    private final AtomicBoolean callbackInvoked = new AtomicBoolean(false);
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile TaskResult result;

    private RequestTask(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.endpoint = builder.endpoint;
        this.method = Objects.requireNonNull(builder.method, "method is required");
        this.body = builder.body;
        this.transport = builder.transport;
        this.onSuccess = builder.onSuccess;
        this.onFailure = builder.onFailure;
        this.createdAt = Instant.now();
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String endpoint() {
        return endpoint;
    }

    public RequestMethod method() {
        return method;
    }

    public String body() {
        return body;
    }

    public Transport transport() {
        return transport;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public TaskStatus status() {
        return status.get();
    }

    public TaskResult result() {
        return result;
    }

    public boolean isTerminal() {
        return status.get().isTerminal();
    }

    // ---- lifecycle transitions (driven by the pool) ----

    /** PENDING → RUNNING. Returns false if the task was already started or cancelled. */
    public boolean markRunning() {
        if (!status.compareAndSet(TaskStatus.PENDING, TaskStatus.RUNNING)) {
            return false;
        }
        startedAt = Instant.now();
        return true;
    }

    /** RUNNING → COMPLETED with the response payload. */
    public boolean markCompleted(TaskResult taskResult) {
        Objects.requireNonNull(taskResult, "taskResult");
        return finish(TaskStatus.RUNNING, TaskStatus.COMPLETED, taskResult);
    }

    /** RUNNING → FAILED with an error-carrying result. */
    public boolean markFailed(TaskResult taskResult) {
        Objects.requireNonNull(taskResult, "taskResult");
        return finish(TaskStatus.RUNNING, TaskStatus.FAILED, taskResult);
    }

    /** PENDING → CANCELLED. A task that has started is never cancelled. */
    public boolean markCancelled() {
        return finish(TaskStatus.PENDING, TaskStatus.CANCELLED, null);
    }

    private boolean finish(TaskStatus expected, TaskStatus target, TaskResult taskResult) {
        if (status.get() != expected) {
            return false;
        }
        // published before the status flips so a terminal task always has its result
        if (taskResult != null) {
            this.result = taskResult;
        }
        if (!status.compareAndSet(expected, target)) {
            return false;
        }
        completedAt = Instant.now();
        return true;
    }

    /**
     * Invoke the success callback, if any. At most one callback ever runs per task.
     */
    public void fireSuccess() {
        if (onSuccess != null && callbackInvoked.compareAndSet(false, true)) {
            onSuccess.accept(this);
        }
    }

    /**
     * Invoke the failure callback, if any. At most one callback ever runs per task.
     */
    public void fireFailure(TransportException error) {
        if (onFailure != null && callbackInvoked.compareAndSet(false, true)) {
            onFailure.accept(this, error);
        }
    }

    /** Builder for a GET task. */
    public static Builder get(String endpoint) {
        return builder().endpoint(endpoint).method(RequestMethod.GET);
    }

    /** Builder for a POST task. */
    public static Builder post(String endpoint, String body) {
        return builder().endpoint(endpoint).method(RequestMethod.POST).body(body);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String endpoint;
        private RequestMethod method = RequestMethod.GET;
        private String body;
        private Transport transport;
        private Consumer<RequestTask> onSuccess;
        private BiConsumer<RequestTask, TransportException> onFailure;

        /** Override the generated identifier. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder method(RequestMethod method) {
            this.method = method;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        /** Use this transport instead of the pool default. */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder onSuccess(Consumer<RequestTask> onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(BiConsumer<RequestTask, TransportException> onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public RequestTask build() {
            return new RequestTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RequestTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RequestTask{id='" + id + "', method=" + method + ", endpoint='" + endpoint
                + "', status=" + status.get() + '}';
    }
}
