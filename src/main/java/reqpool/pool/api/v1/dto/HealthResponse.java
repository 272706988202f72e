package reqpool.pool.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("dispatchState") String dispatchState,
        @JsonProperty("maxConcurrency") Integer maxConcurrency,
        @JsonProperty("availableSlots") Integer availableSlots) {
    public static HealthResponse healthy(String uptime, String version, String dispatchState, int maxConcurrency,
            int availableSlots) {
        return new HealthResponse("healthy", uptime, version, dispatchState, maxConcurrency, availableSlots);
    }

    /** The pool refuses new work. */
    public static HealthResponse stopped(String uptime, String version) {
        return new HealthResponse("stopped", uptime, version, "STOPPED", null, null);
    }
}
