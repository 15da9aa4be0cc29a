package taskforge.coordinator.liveness;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Worker as reported by the monitoring API.
 */
public record WorkerView(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("status") WorkerStatus status,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat) {
}
