package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO identifying the calling worker.
 * POST /internal/v1/jobs/claim, POST /internal/v1/jobs/{taskId}/ack
 */
public record WorkerRequest(
        @JsonProperty("workerId") String workerId) {
    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }
}
