package taskforge.coordinator.reconcile;

import taskforge.coordinator.model.TaskStatus;
import taskforge.exception.InvalidStateTransitionException;

import java.util.EnumSet;

/**
 * Task lifecycle: QUEUED -> RUNNING -> {COMPLETED | FAILED | TIMEOUT}.
 * <p>
 * CLAIMED on a RUNNING task is accepted and only reassigns the worker, so redelivery
 * after a retry is harmless. Any event on a terminal task is rejected, which is what
 * makes duplicate result delivery idempotent.
 */
public final class TaskStateMachine {

    public Transition apply(TaskStatus current, TaskEvent event) {
        return switch (current) {
            case QUEUED -> switch (event) {
                case CLAIMED -> new Transition(current, TaskStatus.RUNNING,
                        EnumSet.of(TransitionEffect.STAMP_STARTED_AT, TransitionEffect.ASSIGN_WORKER));
                case COMPLETED, FAILED, TIMED_OUT -> throw invalid(current, event);
            };
            case RUNNING -> switch (event) {
                case CLAIMED -> new Transition(current, TaskStatus.RUNNING,
                        EnumSet.of(TransitionEffect.ASSIGN_WORKER));
                case COMPLETED -> finish(TaskStatus.COMPLETED);
                case FAILED -> finish(TaskStatus.FAILED);
                case TIMED_OUT -> finish(TaskStatus.TIMEOUT);
            };
            case COMPLETED, FAILED, TIMEOUT -> throw invalid(current, event);
        };
    }

    private static Transition finish(TaskStatus to) {
        return new Transition(TaskStatus.RUNNING, to,
                EnumSet.of(TransitionEffect.STAMP_COMPLETED_AT, TransitionEffect.ASSIGN_WORKER));
    }

    private static InvalidStateTransitionException invalid(TaskStatus current, TaskEvent event) {
        return new InvalidStateTransitionException(current.name(), event.name());
    }
}
