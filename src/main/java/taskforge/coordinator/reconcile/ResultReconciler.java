package taskforge.coordinator.reconcile;

import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskStatus;
import taskforge.coordinator.model.TaskUpdate;
import taskforge.coordinator.repository.TaskStore;
import taskforge.exception.InvalidStateTransitionException;
import taskforge.exception.ReconciliationConflictException;
import taskforge.exception.TaskNotFoundException;
import taskforge.exception.ValidationException;
import taskforge.protocol.ResultMessage;
import taskforge.protocol.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies worker results and dispatch acknowledgments to the task store.
 * <p>
 * Every write is conditional on the status read just before it. A writer that loses
 * the race re-reads and re-evaluates, so concurrent duplicates resolve to one update
 * and the loser reports {@link ReconcileOutcome#ALREADY_TERMINAL}.
 */
public class ResultReconciler {

    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final TaskStore taskStore;
    private final TaskStateMachine stateMachine;
    private final Clock clock;

    public ResultReconciler(TaskStore taskStore, TaskStateMachine stateMachine, Clock clock) {
        this.taskStore = taskStore;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    /**
     * Apply a worker result message.
     *
     * @throws TaskNotFoundException if the task does not exist
     * @throws ValidationException   if the message is malformed
     */
    public ReconcileOutcome apply(ResultMessage message) {
        try {
            message.validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        try {
            if (message.status() == ResultStatus.FAILED && !message.finalAttempt()) {
                Task task = load(message.taskId());
                if (task.isTerminal()) {
                    throw conflict(task, new InvalidStateTransitionException(
                            task.status().name(), TaskEvent.FAILED.name()));
                }
                log.info("Task {} attempt {} failed on {}, awaiting retry: {}",
                        message.taskId(), message.attempt(), message.workerId(), message.errorMessage());
                return ReconcileOutcome.RETRY_PENDING;
            }

            TaskEvent event = toEvent(message);
            return applyTerminalEvent(message.taskId(), message.workerId(), event,
                    message.status() == ResultStatus.COMPLETED ? message.result() : null,
                    message.status() == ResultStatus.FAILED ? errorOrDefault(message.errorMessage()) : null,
                    message.executionTimeMs());
        } catch (ReconciliationConflictException e) {
            return alreadyTerminal(e, "result of attempt " + message.attempt());
        }
    }

    /**
     * Dispatch acknowledgment: QUEUED to RUNNING, or a worker refresh on a RUNNING task.
     *
     * @return APPLIED, or ALREADY_TERMINAL when the task finished before this claim
     * @throws TaskNotFoundException if the task does not exist
     */
    public ReconcileOutcome markRunning(String taskId, String workerId) {
        for (int i = 0; i < MAX_WRITE_ATTEMPTS; i++) {
            Task task = load(taskId);
            Transition transition;
            try {
                transition = transition(task, TaskEvent.CLAIMED);
            } catch (ReconciliationConflictException e) {
                return alreadyTerminal(e, TaskEvent.CLAIMED.name());
            }

            TaskUpdate.Builder update = TaskUpdate.builder()
                    .expectedStatus(task.status())
                    .status(transition.to())
                    .workerId(workerId);
            if (transition.has(TransitionEffect.STAMP_STARTED_AT) && task.startedAt() == null) {
                update.startedAt(clock.instant());
            }

            if (taskStore.update(taskId, update.build()).isPresent()) {
                if (transition.changesStatus()) {
                    log.info("Task {} started on worker {}", taskId, workerId);
                } else {
                    log.debug("Task {} re-claimed by worker {}", taskId, workerId);
                }
                return ReconcileOutcome.APPLIED;
            }
        }
        throw new IllegalStateException("Task " + taskId + " kept changing while marking it running");
    }

    /**
     * Synthesize a final failure for a job the broker moved to its failed bucket.
     * A no-op when the worker's own final result already landed.
     */
    public ReconcileOutcome applyDeadLetter(String taskId, String workerId, String lastError) {
        log.warn("Task {} dead-lettered (last worker {}): {}", taskId, workerId, lastError);
        try {
            return applyTerminalEvent(taskId, workerId, TaskEvent.FAILED, null, errorOrDefault(lastError), null);
        } catch (ReconciliationConflictException e) {
            return alreadyTerminal(e, "dead letter");
        }
    }

    // Helper methods

    private ReconcileOutcome applyTerminalEvent(String taskId, String workerId, TaskEvent event,
            String result, String errorMessage, Long executionTimeMs) {
        for (int i = 0; i < MAX_WRITE_ATTEMPTS; i++) {
            Task task = load(taskId);

            Instant now = clock.instant();
            TaskUpdate.Builder update = TaskUpdate.builder().expectedStatus(task.status());

            Transition transition;
            if (task.status() == TaskStatus.QUEUED) {
                // The claim acknowledgment never landed; apply it implicitly first
                Transition claimed = stateMachine.apply(task.status(), TaskEvent.CLAIMED);
                transition = stateMachine.apply(claimed.to(), event);
                if (task.startedAt() == null) {
                    update.startedAt(now);
                }
            } else {
                transition = transition(task, event);
            }

            update.status(transition.to())
                    .workerId(workerId)
                    .result(result)
                    .errorMessage(errorMessage)
                    .executionTimeMs(executionTimeMs);
            if (transition.has(TransitionEffect.STAMP_COMPLETED_AT) && task.completedAt() == null) {
                update.completedAt(now);
            }

            Optional<Task> updated = taskStore.update(taskId, update.build());
            if (updated.isPresent()) {
                log.info("Task {} {} on worker {}", taskId, transition.to(), workerId);
                return ReconcileOutcome.APPLIED;
            }
            log.debug("Task {} changed concurrently, re-evaluating {}", taskId, event);
        }
        throw new IllegalStateException("Task " + taskId + " kept changing while applying " + event);
    }

    private Task load(String taskId) {
        return taskStore.findById(taskId).orElseThrow(() -> {
            log.warn("Result for unknown task {}", taskId);
            return new TaskNotFoundException(taskId);
        });
    }

    /**
     * Run the state machine, turning a rejection on a terminal task into a conflict.
     */
    private Transition transition(Task task, TaskEvent event) {
        try {
            return stateMachine.apply(task.status(), event);
        } catch (InvalidStateTransitionException e) {
            if (task.isTerminal()) {
                throw conflict(task, e);
            }
            throw e;
        }
    }

    private static ReconciliationConflictException conflict(Task task, InvalidStateTransitionException cause) {
        return new ReconciliationConflictException(task.id(), task.status().name(), cause);
    }

    private static ReconcileOutcome alreadyTerminal(ReconciliationConflictException conflict, String what) {
        log.info("Ignoring {}: {}", what, conflict.getMessage());
        return ReconcileOutcome.ALREADY_TERMINAL;
    }

    private static TaskEvent toEvent(ResultMessage message) {
        return switch (message.status()) {
            case COMPLETED -> TaskEvent.COMPLETED;
            case FAILED -> message.timedOut() ? TaskEvent.TIMED_OUT : TaskEvent.FAILED;
        };
    }

    private static String errorOrDefault(String errorMessage) {
        return errorMessage != null && !errorMessage.isBlank() ? errorMessage : "Unknown error";
    }
}
