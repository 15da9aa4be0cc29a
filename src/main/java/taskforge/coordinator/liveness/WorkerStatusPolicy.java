package taskforge.coordinator.liveness;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Pure derivation of worker status from heartbeat age.
 * <ul>
 *   <li>age &lt; activeThreshold: ACTIVE</li>
 *   <li>activeThreshold &lt;= age &lt; idleThreshold: IDLE</li>
 *   <li>otherwise: STALE</li>
 * </ul>
 */
public final class WorkerStatusPolicy {

    public static final String TYPE_LOCAL = "local";
    public static final String TYPE_CLOUD = "cloud";

    private final Duration activeThreshold;
    private final Duration idleThreshold;

    public WorkerStatusPolicy(Duration activeThreshold, Duration idleThreshold) {
        if (idleThreshold.compareTo(activeThreshold) < 0) {
            throw new IllegalArgumentException("idleThreshold must be >= activeThreshold");
        }
        this.activeThreshold = activeThreshold;
        this.idleThreshold = idleThreshold;
    }

    public static WorkerStatusPolicy defaults() {
        return new WorkerStatusPolicy(Duration.ofSeconds(15), Duration.ofSeconds(30));
    }

    public WorkerStatus derive(Duration age) {
        if (age.compareTo(activeThreshold) < 0) {
            return WorkerStatus.ACTIVE;
        }
        if (age.compareTo(idleThreshold) < 0) {
            return WorkerStatus.IDLE;
        }
        return WorkerStatus.STALE;
    }

    /**
     * Worker type from the heartbeat record, or inferred from the id prefix when absent.
     */
    public String resolveType(String workerId, String storedType) {
        if (storedType != null && !storedType.isBlank()) {
            return storedType;
        }
        return workerId.startsWith("cloud-") ? TYPE_CLOUD : TYPE_LOCAL;
    }

    /**
     * View of the record at {@code now}, or empty if the worker is stale.
     */
    public Optional<WorkerView> view(HeartbeatRecord record, Instant now) {
        Duration age = Duration.between(record.lastSeen(), now);
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        WorkerStatus status = derive(age);
        if (status == WorkerStatus.STALE) {
            return Optional.empty();
        }
        return Optional.of(new WorkerView(
                record.workerId(),
                resolveType(record.workerId(), record.type()),
                status,
                record.lastSeen()));
    }
}
