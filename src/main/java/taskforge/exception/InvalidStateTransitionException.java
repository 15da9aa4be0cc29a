package taskforge.exception;

/**
 * Thrown by the task state machine when an event is not valid in the current status.
 */
public class InvalidStateTransitionException extends TaskForgeException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String currentState, String event) {
        super(ERROR_CODE, String.format("Cannot apply %s to a task in %s", event, currentState));
    }
}
