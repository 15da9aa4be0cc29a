package taskforge.coordinator.service;

import org.junit.jupiter.api.*;
import taskforge.coordinator.api.v1.dto.SubmitTaskRequest;
import taskforge.coordinator.config.CoordinatorConfig;
import taskforge.coordinator.config.Dependencies;
import taskforge.coordinator.liveness.WorkerStatus;
import taskforge.coordinator.liveness.WorkerView;
import taskforge.testing.MutableClock;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonitoringServiceTest {

    private MutableClock clock;
    private Dependencies deps;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-monitor-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"), clock);
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("worker goes ACTIVE, then IDLE, then disappears")
    void testWorkerAging() {
        deps.livenessRegistry().heartbeat("cloud-1", null);

        clock.advance(Duration.ofSeconds(10));
        List<WorkerView> workers = deps.monitoringService().getWorkerList();
        assertEquals(1, workers.size());
        assertEquals("cloud-1", workers.get(0).id());
        assertEquals("cloud", workers.get(0).type());
        assertEquals(WorkerStatus.ACTIVE, workers.get(0).status());

        clock.advance(Duration.ofSeconds(10));
        assertEquals(WorkerStatus.IDLE, deps.monitoringService().getWorkerList().get(0).status());

        clock.advance(Duration.ofSeconds(10));
        assertTrue(deps.monitoringService().getWorkerList().isEmpty());
    }

    @Test
    @DisplayName("task and queue stats reflect submissions and claims")
    void testStats() {
        deps.submissionService().submit(new SubmitTaskRequest("a", null, null));
        deps.submissionService().submit(new SubmitTaskRequest("b", null, null));
        deps.dispatchService().claim("w1");

        TaskStats tasks = deps.monitoringService().getTaskStats();
        assertEquals(2, tasks.total());
        assertEquals(1, tasks.queued());
        assertEquals(1, tasks.running());

        assertEquals(1, deps.monitoringService().getQueueStats().waiting());
        assertEquals(1, deps.monitoringService().getQueueStats().active());
    }
}
