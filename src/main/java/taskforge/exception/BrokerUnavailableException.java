package taskforge.exception;

/**
 * Thrown when the queue transport cannot be reached.
 * The caller must not assume the operation took effect.
 */
public class BrokerUnavailableException extends TaskForgeException {

    public static final String ERROR_CODE = "BROKER_UNAVAILABLE";

    public BrokerUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public BrokerUnavailableException(String message) {
        super(ERROR_CODE, message);
    }
}
