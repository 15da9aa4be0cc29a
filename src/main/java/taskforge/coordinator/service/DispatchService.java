package taskforge.coordinator.service;

import taskforge.coordinator.broker.BrokerState;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.coordinator.reconcile.ReconcileOutcome;
import taskforge.coordinator.reconcile.ResultReconciler;
import taskforge.exception.TaskNotFoundException;
import taskforge.protocol.ClaimedJob;
import taskforge.worker.JobSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Dispatch path between the broker and workers.
 * Claiming a job also marks its task RUNNING; jobs whose task is gone or
 * already finished are acked and skipped.
 */
public class DispatchService implements JobSource {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private static final int MAX_SKIPPED_PER_CLAIM = 10;

    public static final String DISPATCH_LOST_ERROR = "Dispatch record lost";

    private final JobBroker broker;
    private final ResultReconciler reconciler;

    public DispatchService(JobBroker broker, ResultReconciler reconciler) {
        this.broker = broker;
        this.reconciler = reconciler;
    }

    @Override
    public Optional<ClaimedJob> claim(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        for (int i = 0; i < MAX_SKIPPED_PER_CLAIM; i++) {
            Optional<ClaimedJob> claimed = broker.claim(workerId);
            if (claimed.isEmpty()) {
                return Optional.empty();
            }

            ClaimedJob job = claimed.get();
            try {
                if (reconciler.markRunning(job.taskId(), workerId) == ReconcileOutcome.APPLIED) {
                    return claimed;
                }
                log.info("Skipping dispatch of finished task {}", job.taskId());
            } catch (TaskNotFoundException e) {
                log.warn("Skipping dispatch of deleted task {}", job.taskId());
            }
            broker.ack(job.taskId(), workerId);
        }
        return Optional.empty();
    }

    @Override
    public void ack(String taskId, String workerId) {
        broker.ack(taskId, workerId);
    }

    @Override
    public void retry(String taskId, String workerId, String error) {
        reportFailure(taskId, workerId, error);
    }

    /**
     * Hand a failed attempt to the broker. When the broker gives up on the job,
     * the task is failed with the last error.
     */
    public RetryDecision reportFailure(String taskId, String workerId, String error) {
        RetryDecision decision = broker.retry(taskId, workerId, error);
        if (decision.isDeadLettered()) {
            try {
                reconciler.applyDeadLetter(taskId, workerId, error);
            } catch (TaskNotFoundException e) {
                log.warn("Dead-lettered job for deleted task {}", taskId);
            }
        }
        return decision;
    }

    /**
     * Fail a RUNNING task whose dispatch the broker has given up on or no longer holds.
     * Covers a dead letter whose task update did not land.
     *
     * @return true if this call failed the task
     */
    public boolean failIfStranded(String taskId, String workerId) {
        Optional<BrokerState> state = broker.stateOf(taskId);
        if (state.isPresent() && state.get() != BrokerState.FAILED) {
            return false;
        }

        String error = state.isPresent() ? broker.lastError(taskId).orElse(null) : DISPATCH_LOST_ERROR;
        try {
            return reconciler.applyDeadLetter(taskId, workerId, error) == ReconcileOutcome.APPLIED;
        } catch (TaskNotFoundException e) {
            log.debug("Stranded task {} was deleted", taskId);
            return false;
        }
    }
}
