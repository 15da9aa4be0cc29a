package taskforge.coordinator.liveness;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskforge.testing.MutableClock;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLivenessRegistryTest {

    private MutableClock clock;
    private InMemoryLivenessRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        registry = new InMemoryLivenessRegistry(clock, Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("heartbeat registers and refreshes a worker")
    void testHeartbeat() {
        registry.heartbeat("w1", "local");
        clock.advance(Duration.ofSeconds(20));
        registry.heartbeat("w1", "local");

        List<HeartbeatRecord> records = registry.list();
        assertEquals(1, records.size());
        assertEquals(clock.instant(), records.get(0).lastSeen());
        assertEquals(clock.instant().plusSeconds(30), records.get(0).expiresAt());
    }

    @Test
    @DisplayName("a ping without type keeps the known type")
    void testTypeRetained() {
        registry.heartbeat("w1", "cloud");
        registry.heartbeat("w1", null);

        assertEquals("cloud", registry.list().get(0).type());
    }

    @Test
    @DisplayName("list is newest first and hides expired records")
    void testListOrderAndExpiry() {
        registry.heartbeat("old", "local");
        clock.advance(Duration.ofSeconds(10));
        registry.heartbeat("new", "local");

        assertEquals(List.of("new", "old"), registry.list().stream().map(HeartbeatRecord::workerId).toList());

        clock.advance(Duration.ofSeconds(20));
        assertEquals(List.of("new"), registry.list().stream().map(HeartbeatRecord::workerId).toList());
        assertEquals(2, registry.size(), "expired record stays until pruned");
    }

    @Test
    @DisplayName("prune removes expired records")
    void testPrune() {
        registry.heartbeat("w1", "local");
        registry.heartbeat("w2", "local");
        clock.advance(Duration.ofSeconds(15));
        registry.heartbeat("w2", "local");
        clock.advance(Duration.ofSeconds(15));

        assertEquals(List.of("w1"), registry.prune());
        assertEquals(1, registry.size());
        assertTrue(registry.prune().isEmpty());
    }

    @Test
    void testBlankWorkerIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.heartbeat(" ", "local"));
    }
}
