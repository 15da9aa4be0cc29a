package taskforge.coordinator.broker;

import taskforge.protocol.ClaimedJob;
import taskforge.protocol.DispatchMessage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable queue of dispatch records, keyed by task id.
 * <p>
 * The broker owns delivery (at-least-once, per-key dedup, retry, dead bucket)
 * but never task state: it does not touch the task store.
 * All operations throw {@link taskforge.exception.BrokerUnavailableException}
 * when the backing transport cannot be reached.
 */
public interface JobBroker {

    /**
     * Append a dispatch record under {@code message.taskId()}.
     *
     * @return {@link EnqueueResult#DUPLICATE} if a waiting, delayed or active record already exists
     */
    EnqueueResult enqueue(DispatchMessage message);

    /**
     * Hand the next eligible record to exactly one caller and mark it active.
     *
     * @param workerId the claiming worker
     * @return the claimed job, or empty if nothing is eligible right now
     */
    Optional<ClaimedJob> claim(String workerId);

    /**
     * Mark an active record as completed.
     *
     * @return false if the record is not active for this worker
     */
    boolean ack(String taskId, String workerId);

    /**
     * Report a failed attempt. Schedules a delayed retry while attempts remain,
     * otherwise moves the record to the failed bucket.
     */
    RetryDecision retry(String taskId, String workerId, String error);

    /**
     * Current state of the record for the task, if the broker still holds one.
     */
    Optional<BrokerState> stateOf(String taskId);

    /**
     * Error reported by the last failed attempt, if the broker still holds the record and one was reported.
     */
    Optional<String> lastError(String taskId);

    /**
     * Whether a waiting, delayed or active record exists for the task.
     */
    default boolean isLive(String taskId) {
        return stateOf(taskId).map(BrokerState::isLive).orElse(false);
    }

    /**
     * Active records whose lease deadline is before {@code now}.
     */
    List<ActiveJob> findExpiredLeases(Instant now);

    /**
     * Remove finished records beyond the retention policy.
     *
     * @return number of records removed
     */
    int purgeFinished();

    /**
     * Point-in-time counts per broker state.
     */
    QueueStats stats();
}
