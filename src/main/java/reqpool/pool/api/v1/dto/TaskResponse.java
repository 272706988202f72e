package reqpool.pool.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reqpool.pool.model.RequestTask;
import reqpool.pool.model.TaskResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Response DTO for a single task.
 * GET /api/v1/tasks, GET /api/v1/tasks/{id}
 *
 * The response body is only included for single-task lookups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("method") String method,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("statusCode") Integer statusCode,
        @JsonProperty("error") String error,
        @JsonProperty("body") String body) {

    /** Full view including the response body */
    public static TaskResponse from(RequestTask task) {
        TaskResult result = task.result();
        return new TaskResponse(
                task.id(),
                task.name(),
                task.method().name(),
                task.endpoint(),
                task.status().name(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                durationMs(task),
                result != null && result.statusCode() > 0 ? result.statusCode() : null,
                result != null && result.hasError() ? result.errorMessage() : null,
                result != null ? result.body() : null);
    }

    /** Compact version for list responses */
    public TaskResponse compact() {
        return new TaskResponse(
                id, name, method, endpoint, status, createdAt, startedAt, completedAt,
                durationMs, statusCode, error, null);
    }

    private static Long durationMs(RequestTask task) {
        Instant started = task.startedAt();
        Instant completed = task.completedAt();
        if (started == null || completed == null) {
            return null;
        }
        return Duration.between(started, completed).toMillis();
    }
}
