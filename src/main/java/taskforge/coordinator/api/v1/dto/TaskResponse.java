package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * Response DTO for a task.
 * GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("code") String code,
        @JsonProperty("timeout") int timeout,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("result") String result,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("executionTimeMs") Long executionTimeMs,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.status(),
                task.prompt(),
                task.code(),
                task.timeout(),
                task.workerId(),
                task.result(),
                task.errorMessage(),
                task.executionTimeMs(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt());
    }
}
