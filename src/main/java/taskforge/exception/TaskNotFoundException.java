package taskforge.exception;

/**
 * Thrown when a result or a query references an unknown task id.
 */
public class TaskNotFoundException extends TaskForgeException {

    public static final String ERROR_CODE = "TASK_NOT_FOUND";

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ERROR_CODE, String.format("Task not found: %s", taskId));
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
