package taskforge.coordinator.liveness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heartbeat registry held in process memory, keyed by worker id.
 * Records expire after a fixed TTL; expired entries are invisible to {@link #list()}
 * and removed by {@link #prune()}.
 */
public class InMemoryLivenessRegistry implements LivenessRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLivenessRegistry.class);

    private final ConcurrentHashMap<String, HeartbeatRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryLivenessRegistry(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public void heartbeat(String workerId, String type) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        Instant now = clock.instant();
        records.compute(workerId, (id, previous) -> {
            // Keep the known type when a ping omits it
            String effectiveType = type != null && !type.isBlank()
                    ? type
                    : previous != null ? previous.type() : null;
            if (previous == null) {
                log.info("Worker {} registered (type={})", id, effectiveType);
            }
            return new HeartbeatRecord(id, effectiveType, now, now.plus(ttl));
        });
    }

    @Override
    public List<HeartbeatRecord> list() {
        Instant now = clock.instant();
        List<HeartbeatRecord> live = new ArrayList<>(records.size());
        for (HeartbeatRecord record : records.values()) {
            if (!record.isExpired(now)) {
                live.add(record);
            }
        }
        live.sort(Comparator.comparing(HeartbeatRecord::lastSeen).reversed());
        return live;
    }

    @Override
    public List<String> prune() {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();
        for (Iterator<HeartbeatRecord> it = records.values().iterator(); it.hasNext();) {
            HeartbeatRecord record = it.next();
            if (record.isExpired(now)) {
                removed.add(record.workerId());
                it.remove();
            }
        }
        if (!removed.isEmpty()) {
            log.info("Pruned expired workers: {}", removed);
        }
        return removed;
    }

    @Override
    public int size() {
        return records.size();
    }
}
