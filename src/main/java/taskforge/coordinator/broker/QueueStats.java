package taskforge.coordinator.broker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of broker record counts. Not transactionally consistent with the task store.
 */
public record QueueStats(
        @JsonProperty("waiting") int waiting,
        @JsonProperty("active") int active,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("delayed") int delayed) {
}
