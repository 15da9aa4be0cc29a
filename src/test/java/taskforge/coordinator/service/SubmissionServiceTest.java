package taskforge.coordinator.service;

import org.junit.jupiter.api.*;
import taskforge.coordinator.api.v1.dto.SubmissionReceipt;
import taskforge.coordinator.api.v1.dto.SubmitTaskRequest;
import taskforge.coordinator.api.v1.dto.TaskListQuery;
import taskforge.coordinator.api.v1.dto.TaskPageResponse;
import taskforge.coordinator.api.v1.dto.TaskResponse;
import taskforge.coordinator.broker.ActiveJob;
import taskforge.coordinator.broker.BrokerState;
import taskforge.coordinator.broker.EnqueueResult;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.QueueStats;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.coordinator.config.CoordinatorConfig;
import taskforge.coordinator.config.Dependencies;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskStatus;
import taskforge.exception.BrokerUnavailableException;
import taskforge.exception.TaskNotFoundException;
import taskforge.exception.TaskNotTerminalException;
import taskforge.exception.ValidationException;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.DispatchMessage;
import taskforge.protocol.ResultMessage;
import taskforge.testing.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionServiceTest {

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-submit-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("submit stores a QUEUED task and enqueues its dispatch")
    void testSubmit() {
        SubmissionReceipt receipt = deps.submissionService()
                .submit(new SubmitTaskRequest("echo hi", "print('x')", 90));

        assertNotNull(receipt.id());
        assertEquals(TaskStatus.QUEUED, receipt.status());
        assertNotNull(receipt.createdAt());

        Task task = deps.submissionService().get(receipt.id());
        assertEquals("echo hi", task.prompt());
        assertEquals("print('x')", task.code());
        assertEquals(90, task.timeout());
        assertEquals(Optional.of(BrokerState.WAITING), deps.jobBroker().stateOf(receipt.id()));
    }

    @Test
    @DisplayName("timeout defaults to 300 seconds")
    void testDefaultTimeout() {
        SubmissionReceipt receipt = deps.submissionService().submit(new SubmitTaskRequest("echo hi", null, null));
        assertEquals(300, deps.submissionService().get(receipt.id()).timeout());
    }

    @Test
    @DisplayName("invalid submissions are rejected and nothing is stored")
    void testValidation() {
        SubmissionService service = deps.submissionService();

        assertThrows(ValidationException.class, () -> service.submit(new SubmitTaskRequest("", null, null)));
        assertThrows(ValidationException.class, () -> service.submit(new SubmitTaskRequest("  ", null, null)));
        assertThrows(ValidationException.class, () -> service.submit(new SubmitTaskRequest(null, null, null)));
        assertThrows(ValidationException.class, () -> service.submit(new SubmitTaskRequest("x", null, 0)));
        assertThrows(ValidationException.class, () -> service.submit(new SubmitTaskRequest("x", null, 3601)));

        assertEquals(0, deps.monitoringService().getTaskStats().total());
        assertEquals(0, deps.jobBroker().stats().waiting());
    }

    @Test
    @DisplayName("timeout bounds are inclusive")
    void testTimeoutBounds() {
        assertDoesNotThrow(() -> deps.submissionService().submit(new SubmitTaskRequest("x", null, 1)));
        assertDoesNotThrow(() -> deps.submissionService().submit(new SubmitTaskRequest("x", null, 3600)));
    }

    @Test
    @DisplayName("broker outage leaves the task QUEUED and surfaces the error")
    void testBrokerUnavailable() {
        SubmissionService service = new SubmissionService(deps.taskStore(), new UnavailableBroker());

        assertThrows(BrokerUnavailableException.class,
                () -> service.submit(new SubmitTaskRequest("echo hi", null, null)));

        assertEquals(1, deps.taskStore().countByStatus().get(TaskStatus.QUEUED));
    }

    @Test
    @DisplayName("get and delete of unknown tasks throw TaskNotFoundException")
    void testNotFound() {
        assertThrows(TaskNotFoundException.class, () -> deps.submissionService().get("missing"));
        assertThrows(TaskNotFoundException.class, () -> deps.submissionService().delete("missing"));
    }

    @Test
    @DisplayName("only terminal tasks can be deleted")
    void testDelete() {
        SubmissionReceipt receipt = deps.submissionService().submit(new SubmitTaskRequest("echo hi", null, null));

        assertThrows(TaskNotTerminalException.class, () -> deps.submissionService().delete(receipt.id()));

        ClaimedJob job = deps.dispatchService().claim("w1").orElseThrow();
        deps.resultPublisher().publish(ResultMessage.completed(job, "w1", "hi", 3));
        deps.submissionService().delete(receipt.id());

        assertThrows(TaskNotFoundException.class, () -> deps.submissionService().get(receipt.id()));
    }

    @Test
    @DisplayName("list pages tasks newest first and counts the filtered total")
    void testList() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        try (Dependencies clocked = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-submit-list-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"), clock)) {
            SubmissionService service = clocked.submissionService();
            String first = service.submit(new SubmitTaskRequest("first", null, 10)).id();
            clock.advance(Duration.ofSeconds(1));
            String second = service.submit(new SubmitTaskRequest("second", null, 10)).id();
            clock.advance(Duration.ofSeconds(1));
            String third = service.submit(new SubmitTaskRequest("third", null, 10)).id();
            clocked.dispatchService().claim("w1");

            TaskPageResponse page = service.list(new TaskListQuery(null, 1, 2));
            assertEquals(List.of(third, second), page.tasks().stream().map(TaskResponse::id).toList());
            assertEquals(3, page.total());
            assertEquals(2, page.totalPages());

            TaskPageResponse last = service.list(new TaskListQuery(null, 2, 2));
            assertEquals(List.of(first), last.tasks().stream().map(TaskResponse::id).toList());

            TaskPageResponse running = service.list(new TaskListQuery(TaskStatus.RUNNING, 1, 10));
            assertEquals(List.of(first), running.tasks().stream().map(TaskResponse::id).toList());
            assertEquals(1, running.total());
        }
    }

    @Test
    @DisplayName("list query rejects out-of-range paging")
    void testListQueryValidation() {
        assertThrows(ValidationException.class, () -> new TaskListQuery(null, 0, 10));
        assertThrows(ValidationException.class, () -> new TaskListQuery(null, 1, TaskListQuery.MAX_LIMIT + 1));
        assertThrows(ValidationException.class,
                () -> TaskListQuery.fromParameters(Map.of("status", List.of("DONE"))));

        TaskListQuery defaults = TaskListQuery.fromParameters(Map.of());
        assertNull(defaults.status());
        assertEquals(TaskListQuery.DEFAULT_PAGE, defaults.page());
        assertEquals(TaskListQuery.DEFAULT_LIMIT, defaults.limit());
    }

    /**
     * Broker whose backing store is down.
     */
    private static final class UnavailableBroker implements JobBroker {

        private static BrokerUnavailableException down() {
            return new BrokerUnavailableException("broker is down");
        }

        @Override
        public EnqueueResult enqueue(DispatchMessage message) {
            throw down();
        }

        @Override
        public Optional<ClaimedJob> claim(String workerId) {
            throw down();
        }

        @Override
        public boolean ack(String taskId, String workerId) {
            throw down();
        }

        @Override
        public RetryDecision retry(String taskId, String workerId, String error) {
            throw down();
        }

        @Override
        public Optional<BrokerState> stateOf(String taskId) {
            throw down();
        }

        @Override
        public Optional<String> lastError(String taskId) {
            throw down();
        }

        @Override
        public List<ActiveJob> findExpiredLeases(Instant now) {
            throw down();
        }

        @Override
        public int purgeFinished() {
            throw down();
        }

        @Override
        public QueueStats stats() {
            throw down();
        }
    }
}
