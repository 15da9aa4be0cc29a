package taskforge.worker;

/**
 * Lifecycle of one worker slot: IDLE -> CLAIMED -> EXECUTING -> REPORTING -> IDLE.
 */
public enum SlotState {
    /** Polling for work */
    IDLE,
    /** Holds a job that has not started executing */
    CLAIMED,
    /** The executor is running the job */
    EXECUTING,
    /** Publishing the result and acking or retrying the job */
    REPORTING
}
