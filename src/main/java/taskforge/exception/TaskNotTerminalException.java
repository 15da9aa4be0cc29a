package taskforge.exception;

import taskforge.coordinator.model.TaskStatus;

/**
 * Thrown when deleting a task that has not reached a terminal state.
 */
public class TaskNotTerminalException extends TaskForgeException {

    public static final String ERROR_CODE = "TASK_NOT_TERMINAL";

    public TaskNotTerminalException(String taskId, TaskStatus status) {
        super(ERROR_CODE, String.format(
                "Task %s is %s; only COMPLETED, FAILED or TIMEOUT tasks can be deleted",
                taskId, status));
    }
}
