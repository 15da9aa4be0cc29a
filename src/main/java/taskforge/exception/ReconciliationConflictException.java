package taskforge.exception;

/**
 * A result arrived for a task that is already terminal.
 * Logged by the reconciler, never surfaced to a caller.
 */
public class ReconciliationConflictException extends TaskForgeException {

    public static final String ERROR_CODE = "RECONCILIATION_CONFLICT";

    public ReconciliationConflictException(String taskId, String currentState, Throwable cause) {
        super(ERROR_CODE, String.format("Task %s is already %s", taskId, currentState), cause);
    }
}
