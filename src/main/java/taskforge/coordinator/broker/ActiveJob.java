package taskforge.coordinator.broker;

import java.time.Instant;

/**
 * An active dispatch record, as seen by the lease sweep.
 */
public record ActiveJob(String taskId, String workerId, int attempts, Instant leaseDeadline) {
}
