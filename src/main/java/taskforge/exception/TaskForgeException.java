package taskforge.exception;

/**
 * Base exception for all coordinator and worker domain errors.
 */
public class TaskForgeException extends RuntimeException {

    private final String errorCode;

    public TaskForgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskForgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
