package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.coordinator.broker.RetryDecision;

/**
 * Response DTO for a reported failure.
 * POST /internal/v1/jobs/{taskId}/retry
 */
public record RetryResponse(
        @JsonProperty("decision") RetryDecision.Outcome decision,
        @JsonProperty("delayMs") long delayMs,
        @JsonProperty("attempts") int attempts) {

    public static RetryResponse from(RetryDecision decision) {
        return new RetryResponse(decision.outcome(), decision.delay().toMillis(), decision.attempts());
    }
}
