package taskforge.coordinator.liveness;

import taskforge.worker.HeartbeatSink;

import java.util.List;

/**
 * Ephemeral store of worker heartbeats.
 * Used for observability only; never consulted for job assignment.
 */
public interface LivenessRegistry extends HeartbeatSink {

    /**
     * All records whose TTL has not expired.
     */
    List<HeartbeatRecord> list();

    /**
     * Drop expired records.
     *
     * @return ids of the workers that were removed
     */
    List<String> prune();

    int size();
}
