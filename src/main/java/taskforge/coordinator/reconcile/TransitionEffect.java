package taskforge.coordinator.reconcile;

/**
 * Side effects a transition asks the writer to persist.
 */
public enum TransitionEffect {
    STAMP_STARTED_AT,
    STAMP_COMPLETED_AT,
    ASSIGN_WORKER
}
