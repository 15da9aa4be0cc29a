package taskforge.worker;

import taskforge.protocol.ClaimedJob;

import java.util.Optional;

/**
 * Where a worker slot gets its jobs from and reports delivery outcomes to.
 */
public interface JobSource {

    /**
     * Claim the next eligible job for this worker.
     *
     * @return the job, or empty if none is available right now
     */
    Optional<ClaimedJob> claim(String workerId);

    /**
     * Confirm the job was handled and must not be redelivered.
     */
    void ack(String taskId, String workerId);

    /**
     * Report a failed attempt so the broker applies its retry policy.
     */
    void retry(String taskId, String workerId, String error);
}
