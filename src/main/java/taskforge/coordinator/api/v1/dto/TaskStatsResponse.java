package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.broker.QueueStats;
import taskforge.coordinator.service.TaskStats;

/**
 * Response DTO for GET /api/v1/tasks/stats.
 * The two halves are read separately and may disagree briefly.
 */
public record TaskStatsResponse(
        @JsonProperty("database") TaskStats database,
        @JsonProperty("queue") QueueStats queue) {
}
