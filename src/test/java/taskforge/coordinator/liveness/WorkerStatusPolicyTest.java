package taskforge.coordinator.liveness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkerStatusPolicyTest {

    private final WorkerStatusPolicy policy = WorkerStatusPolicy.defaults();

    @Test
    @DisplayName("status boundaries are inclusive of the lower threshold")
    void testDerive() {
        assertEquals(WorkerStatus.ACTIVE, policy.derive(Duration.ZERO));
        assertEquals(WorkerStatus.ACTIVE, policy.derive(Duration.ofMillis(14_999)));
        assertEquals(WorkerStatus.IDLE, policy.derive(Duration.ofSeconds(15)));
        assertEquals(WorkerStatus.IDLE, policy.derive(Duration.ofMillis(29_999)));
        assertEquals(WorkerStatus.STALE, policy.derive(Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("type falls back to the id prefix")
    void testResolveType() {
        assertEquals("cloud", policy.resolveType("worker-1", "cloud"));
        assertEquals("cloud", policy.resolveType("cloud-abc", null));
        assertEquals("local", policy.resolveType("worker-1", null));
        assertEquals("local", policy.resolveType("worker-1", " "));
    }

    @Test
    @DisplayName("stale workers have no view")
    void testView() {
        Instant seen = Instant.parse("2026-03-01T10:00:00Z");
        HeartbeatRecord record = new HeartbeatRecord("cloud-7", null, seen, seen.plusSeconds(60));

        WorkerView view = policy.view(record, seen.plusSeconds(20)).orElseThrow();
        assertEquals("cloud-7", view.id());
        assertEquals("cloud", view.type());
        assertEquals(WorkerStatus.IDLE, view.status());
        assertEquals(seen, view.lastHeartbeat());

        assertEquals(Optional.empty(), policy.view(record, seen.plusSeconds(30)));
        assertEquals(WorkerStatus.ACTIVE, policy.view(record, seen.minusSeconds(1)).orElseThrow().status(),
                "clock skew counts as fresh");
    }

    @Test
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerStatusPolicy(Duration.ofSeconds(30), Duration.ofSeconds(15)));
    }
}
