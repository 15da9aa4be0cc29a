package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting a failed attempt.
 * POST /internal/v1/jobs/{taskId}/retry
 */
public record RetryRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("error") String error) {
    /** Max error message length */
    public static final int MAX_ERROR_LENGTH = 10000;

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }

    /** Get truncated error message */
    public String truncatedError() {
        if (error == null) {
            return "Unknown error";
        }
        return error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH) + "..."
                : error;
    }
}
