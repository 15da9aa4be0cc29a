package taskforge.coordinator.reconcile;

/**
 * What the reconciler did with one event.
 */
public enum ReconcileOutcome {
    /** The task record was updated */
    APPLIED,
    /** Non-final failure; the broker will redeliver, so the task was left RUNNING */
    RETRY_PENDING,
    /** The task was already terminal; nothing was written */
    ALREADY_TERMINAL
}
