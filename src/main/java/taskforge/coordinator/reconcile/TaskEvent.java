package taskforge.coordinator.reconcile;

/**
 * Events that drive the task lifecycle.
 */
public enum TaskEvent {
    /** A worker claimed the dispatch (dispatch acknowledgment) */
    CLAIMED,
    /** Worker reported success */
    COMPLETED,
    /** Worker reported a final failure */
    FAILED,
    /** Worker reported that the deadline expired */
    TIMED_OUT
}
