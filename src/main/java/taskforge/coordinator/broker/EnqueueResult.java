package taskforge.coordinator.broker;

/**
 * Result of enqueueing a dispatch message.
 */
public enum EnqueueResult {
    /** A new waiting record was created */
    ENQUEUED,
    /** A live record for the same task id already exists; nothing changed */
    DUPLICATE
}
