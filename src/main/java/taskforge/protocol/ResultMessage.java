package taskforge.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload a worker emits after attempting a task.
 * <p>
 * Exactly one of {@code result} and {@code errorMessage} is meaningful:
 * {@code result} for {@link ResultStatus#COMPLETED}, {@code errorMessage} for
 * {@link ResultStatus#FAILED}. {@code finalAttempt} is false when the broker
 * will retry the dispatch after this failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultMessage(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("status") ResultStatus status,
        @JsonProperty("result") String result,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("executionTimeMs") long executionTimeMs,
        @JsonProperty("timedOut") boolean timedOut,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("finalAttempt") boolean finalAttempt) {

    public static ResultMessage completed(ClaimedJob job, String workerId, String result, long executionTimeMs) {
        return new ResultMessage(job.taskId(), workerId, ResultStatus.COMPLETED, result, null,
                executionTimeMs, false, job.attempt(), true);
    }

    public static ResultMessage failed(ClaimedJob job, String workerId, String errorMessage, long executionTimeMs) {
        return new ResultMessage(job.taskId(), workerId, ResultStatus.FAILED, null, errorMessage,
                executionTimeMs, false, job.attempt(), job.isFinalAttempt());
    }

    public static ResultMessage timedOut(ClaimedJob job, String workerId, String errorMessage, long executionTimeMs) {
        return new ResultMessage(job.taskId(), workerId, ResultStatus.FAILED, null, errorMessage,
                executionTimeMs, true, job.attempt(), job.isFinalAttempt());
    }

    public void validate() {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs must be non-negative");
        }
    }
}
