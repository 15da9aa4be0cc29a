package taskforge.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A dispatch message as handed to one worker by {@code claim}.
 * Carries the attempt bookkeeping so the worker knows whether a failure is final.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimedJob(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("code") String code,
        @JsonProperty("timeout") int timeout,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("maxAttempts") int maxAttempts) {

    public static ClaimedJob of(DispatchMessage message, int attempt, int maxAttempts) {
        return new ClaimedJob(message.taskId(), message.prompt(), message.code(), message.timeout(),
                attempt, maxAttempts);
    }

    /** No broker retry follows a failure of this attempt. */
    @JsonIgnore
    public boolean isFinalAttempt() {
        return attempt >= maxAttempts;
    }
}
