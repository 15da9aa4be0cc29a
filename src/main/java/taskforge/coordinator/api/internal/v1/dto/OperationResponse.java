package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("outcome") String outcome) {
    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    /** Success with the outcome of the operation */
    public static OperationResponse success(String outcome) {
        return new OperationResponse(true, outcome);
    }

    /** The operation was not applied */
    public static OperationResponse rejected(String outcome) {
        return new OperationResponse(false, outcome);
    }
}
