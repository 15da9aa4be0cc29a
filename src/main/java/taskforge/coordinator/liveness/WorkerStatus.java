package taskforge.coordinator.liveness;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived worker status. STALE workers are never reported.
 */
public enum WorkerStatus {
    ACTIVE,
    IDLE,
    STALE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
