package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskforge.protocol.ClaimedJob;

/**
 * Response DTO for a claim. {@code job} is null when nothing is eligible.
 * POST /internal/v1/jobs/claim
 */
public record ClaimResponse(
        @JsonProperty("job") ClaimedJob job) {

    public static ClaimResponse empty() {
        return new ClaimResponse(null);
    }

    public boolean hasJob() {
        return job != null;
    }
}
