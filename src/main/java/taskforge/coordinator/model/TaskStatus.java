package taskforge.coordinator.model;

/**
 * Task lifecycle status.
 * Transitions only along QUEUED -> RUNNING -> {COMPLETED | FAILED | TIMEOUT}.
 */
public enum TaskStatus {
    /** Created and handed to the broker, not yet claimed */
    QUEUED,
    /** Claimed by a worker */
    RUNNING,
    /** Executor finished with exit code 0 */
    COMPLETED,
    /** Executor failed or returned a nonzero exit code */
    FAILED,
    /** Execution exceeded the task deadline */
    TIMEOUT;

    public boolean isTerminal() {
        return switch (this) {
            case QUEUED, RUNNING -> false;
            case COMPLETED, FAILED, TIMEOUT -> true;
        };
    }
}
