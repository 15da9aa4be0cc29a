package taskforge.exception;

/**
 * Execution failure caused by the task deadline expiring.
 */
public class ExecutionTimeoutException extends ExecutionFailureException {

    public static final String ERROR_CODE = "EXECUTION_TIMEOUT";

    public ExecutionTimeoutException(int timeoutSeconds, Throwable cause) {
        super(ERROR_CODE, message(timeoutSeconds), cause);
    }

    public static String message(int timeoutSeconds) {
        return "Task timed out after " + timeoutSeconds + " seconds";
    }
}
