package taskforge.exception;

/**
 * Thrown when a task submission is rejected before it reaches storage or the broker.
 */
public class ValidationException extends TaskForgeException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
