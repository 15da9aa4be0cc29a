package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * Response body for an accepted submission.
 */
public record SubmissionReceipt(
        @JsonProperty("id") String id,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("createdAt") Instant createdAt) {

    public static SubmissionReceipt from(Task task) {
        return new SubmissionReceipt(task.id(), task.status(), task.createdAt());
    }
}
