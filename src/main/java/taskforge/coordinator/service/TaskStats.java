package taskforge.coordinator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.model.TaskStatus;

import java.util.Map;

/**
 * Task counts by status.
 */
public record TaskStats(
        @JsonProperty("total") int total,
        @JsonProperty("queued") int queued,
        @JsonProperty("running") int running,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("timeout") int timeout) {

    public static TaskStats from(Map<TaskStatus, Integer> counts) {
        int queued = counts.getOrDefault(TaskStatus.QUEUED, 0);
        int running = counts.getOrDefault(TaskStatus.RUNNING, 0);
        int completed = counts.getOrDefault(TaskStatus.COMPLETED, 0);
        int failed = counts.getOrDefault(TaskStatus.FAILED, 0);
        int timeout = counts.getOrDefault(TaskStatus.TIMEOUT, 0);
        return new TaskStats(queued + running + completed + failed + timeout,
                queued, running, completed, failed, timeout);
    }
}
