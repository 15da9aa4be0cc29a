package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("queue") String queue,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeWorkers") Integer activeWorkers) {

    public static HealthResponse healthy(String uptime, String version, int activeWorkers) {
        return new HealthResponse("healthy", "ok", "ok", uptime, version, activeWorkers);
    }

    public static HealthResponse unhealthy(String database, String queue) {
        return new HealthResponse("unhealthy", database, queue, null, null, null);
    }
}
