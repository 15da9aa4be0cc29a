package taskforge.exception;

/**
 * Thrown by the worker runtime when a dispatch attempt did not succeed.
 * Propagates to the slot loop so the broker can apply its retry policy.
 */
public class ExecutionFailureException extends TaskForgeException {

    public static final String ERROR_CODE = "EXECUTION_FAILURE";

    public ExecutionFailureException(String message) {
        super(ERROR_CODE, message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected ExecutionFailureException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
