package reqpool.pool.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome payload of a request task.
 * A successful result carries the response; a failed one carries an error message and,
 * when the server answered, the partial response.
 */
public final class TaskResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String body;
    private final int statusCode; // 0 when no response was received
    private final Map<String, List<String>> headers;
    private final String errorMessage; // empty when successful

    private TaskResult(String body, int statusCode, Map<String, List<String>> headers, String errorMessage) {
        this.body = body == null ? "" : body;
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public static TaskResult success(int statusCode, String body, Map<String, List<String>> headers) {
        return new TaskResult(body, statusCode, headers, null);
    }

    public static TaskResult success(int statusCode, String body) {
        return success(statusCode, body, Map.of());
    }

    /** Result for a request that produced no usable response. */
    public static TaskResult error(String errorMessage) {
        return new TaskResult(null, 0, null, Objects.requireNonNullElse(errorMessage, "unknown error"));
    }

    /** Copy of this result with the given error message attached. */
    public TaskResult withError(String errorMessage) {
        return new TaskResult(body, statusCode, headers, Objects.requireNonNullElse(errorMessage, "unknown error"));
    }

    public String body() {
        return body;
    }

    public int statusCode() {
        return statusCode;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean hasError() {
        return !errorMessage.isEmpty();
    }

    /**
     * Parse the body as JSON.
     *
     * @return the parsed tree, or null when the body is blank or not valid JSON
     */
    public JsonNode toJson() {
        if (body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "TaskResult{statusCode=" + statusCode + ", bodyLength=" + body.length()
                + (hasError() ? ", error='" + errorMessage + "'" : "") + '}';
    }
}
