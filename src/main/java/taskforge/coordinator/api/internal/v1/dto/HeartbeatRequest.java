package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for worker heartbeat.
 * POST /internal/v1/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("type") String type) {
    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (type != null && !type.isBlank() && !"local".equals(type) && !"cloud".equals(type)) {
            throw new IllegalArgumentException("type must be 'local' or 'cloud'");
        }
    }
}
