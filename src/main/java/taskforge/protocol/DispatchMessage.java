package taskforge.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Broker payload instructing a worker to execute one task.
 * Keyed by {@code taskId}: the broker holds at most one live record per key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchMessage(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("code") String code,
        @JsonProperty("timeout") int timeout) {
}
