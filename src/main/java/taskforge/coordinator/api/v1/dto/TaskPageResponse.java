package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET /api/v1/tasks.
 */
public record TaskPageResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("total") int total,
        @JsonProperty("page") int page,
        @JsonProperty("limit") int limit,
        @JsonProperty("totalPages") int totalPages) {

    public static TaskPageResponse of(List<TaskResponse> tasks, int total, TaskListQuery query) {
        int totalPages = (total + query.limit() - 1) / query.limit();
        return new TaskPageResponse(tasks, total, query.page(), query.limit(), totalPages);
    }
}
