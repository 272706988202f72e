package reqpool.pool.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import reqpool.pool.model.PoolStatus;

/**
 * Response DTO for pool counters.
 * GET /api/v1/pool/status
 */
public record PoolStatusResponse(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("pendingTasks") int pendingTasks,
        @JsonProperty("runningTasks") int runningTasks,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("failedTasks") int failedTasks,
        @JsonProperty("cancelledTasks") int cancelledTasks,
        @JsonProperty("isRunning") boolean isRunning,
        @JsonProperty("dispatchState") String dispatchState,
        @JsonProperty("maxConcurrency") int maxConcurrency,
        @JsonProperty("availableSlots") int availableSlots) {

    public static PoolStatusResponse from(PoolStatus status, String dispatchState, int maxConcurrency,
            int availableSlots) {
        return new PoolStatusResponse(
                status.totalTasks(),
                status.pendingTasks(),
                status.runningTasks(),
                status.completedTasks(),
                status.failedTasks(),
                status.cancelledTasks(),
                status.isRunning(),
                dispatchState,
                maxConcurrency,
                availableSlots);
    }
}
