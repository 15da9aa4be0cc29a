package taskforge.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.model.NewTask;
import taskforge.exception.ValidationException;

/**
 * Request body for POST /api/v1/tasks.
 */
public record SubmitTaskRequest(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("code") String code,
        @JsonProperty("timeout") Integer timeout) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MAX_TIMEOUT_SECONDS = 3600;

    /**
     * Validate the request.
     *
     * @throws ValidationException if invalid
     */
    public void validate() {
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("prompt is required");
        }
        if (timeout != null && (timeout < MIN_TIMEOUT_SECONDS || timeout > MAX_TIMEOUT_SECONDS)) {
            throw new ValidationException(String.format(
                    "timeout must be between %d and %d seconds", MIN_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS));
        }
    }

    public int effectiveTimeout() {
        return timeout != null ? timeout : DEFAULT_TIMEOUT_SECONDS;
    }

    public NewTask toNewTask() {
        return new NewTask(prompt, code, effectiveTimeout());
    }
}
