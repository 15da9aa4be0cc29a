package taskforge.worker;

import org.junit.jupiter.api.*;
import taskforge.exception.ExecutionFailureException;
import taskforge.exception.ExecutionTimeoutException;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.DispatchMessage;
import taskforge.protocol.ResultMessage;
import taskforge.protocol.ResultStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkerRuntime with in-memory collaborators.
 */
class WorkerRuntimeTest {

    private RecordingJobSource jobSource;
    private List<ResultMessage> published;
    private List<String> heartbeats;
    private WorkerConfig config;

    @BeforeEach
    void setUp() {
        jobSource = new RecordingJobSource();
        published = Collections.synchronizedList(new ArrayList<>());
        heartbeats = Collections.synchronizedList(new ArrayList<>());
        config = WorkerConfig.defaults()
                .withWorkerId("worker-test")
                .withIdleSleep(Duration.ofMillis(20))
                .withHeartbeatInterval(Duration.ofMillis(50))
                .withShutdownTimeout(Duration.ofSeconds(10));
    }

    private WorkerRuntime runtime(TaskExecutor executor) {
        return new WorkerRuntime(config, jobSource, published::add,
                (workerId, type) -> heartbeats.add(workerId), executor, () -> {
                });
    }

    private static ClaimedJob job(String taskId, String prompt, int timeout, int attempt, int maxAttempts) {
        return ClaimedJob.of(new DispatchMessage(taskId, prompt, null, timeout), attempt, maxAttempts);
    }

    private static void await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + timeout);
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("successful execution publishes a completed result")
    void testSuccess() {
        WorkerRuntime runtime = runtime((prompt, code, timeout) -> new ExecutionResult(0, "hi", ""));

        runtime.processJob(job("t1", "echo hi", 10, 1, 3));

        assertEquals(1, published.size());
        ResultMessage result = published.get(0);
        assertEquals("t1", result.taskId());
        assertEquals("worker-test", result.workerId());
        assertEquals(ResultStatus.COMPLETED, result.status());
        assertEquals("hi", result.result());
        assertNull(result.errorMessage());
        assertTrue(result.finalAttempt());
        runtime.close();
    }

    @Test
    @DisplayName("non-zero exit publishes a failure with stderr, or the exit code")
    void testNonZeroExit() {
        WorkerRuntime withStderr = runtime((prompt, code, timeout) -> new ExecutionResult(2, "", "bad input"));
        ExecutionFailureException e = assertThrows(ExecutionFailureException.class,
                () -> withStderr.processJob(job("t1", "x", 10, 1, 3)));
        assertEquals("bad input", e.getMessage());
        assertEquals("bad input", published.get(0).errorMessage());
        assertFalse(published.get(0).finalAttempt(), "broker will retry attempt 1 of 3");

        WorkerRuntime silent = runtime((prompt, code, timeout) -> new ExecutionResult(7, "", ""));
        assertThrows(ExecutionFailureException.class, () -> silent.processJob(job("t2", "x", 10, 3, 3)));
        assertEquals("exit code 7", published.get(1).errorMessage());
        assertTrue(published.get(1).finalAttempt());

        withStderr.close();
        silent.close();
    }

    @Test
    @DisplayName("deadline is enforced even when the executor ignores it")
    void testTimeout() {
        AtomicBoolean interrupted = new AtomicBoolean(false);
        WorkerRuntime runtime = runtime((prompt, code, timeout) -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return new ExecutionResult(0, "late", "");
        });

        long start = System.nanoTime();
        ExecutionTimeoutException e = assertThrows(ExecutionTimeoutException.class,
                () -> runtime.processJob(job("t1", "sleep 3", 1, 1, 1)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals("Task timed out after 1 seconds", e.getMessage());
        assertTrue(elapsedMs < 2500, "returned at the deadline, not after the executor");

        ResultMessage result = published.get(0);
        assertEquals(ResultStatus.FAILED, result.status());
        assertTrue(result.timedOut());
        assertTrue(result.executionTimeMs() >= 1000);
        assertEquals("Task timed out after 1 seconds", result.errorMessage());
        runtime.close();
    }

    @Test
    @DisplayName("executor that kills its own process at the deadline reports a timeout")
    void testExecutorReportedTimeout() {
        WorkerRuntime runtime = runtime((prompt, code, timeout) ->
                ExecutionResult.timedOut("partial", "Task timed out after 1 seconds"));

        assertThrows(ExecutionTimeoutException.class, () -> runtime.processJob(job("t1", "sleep 3", 1, 1, 3)));

        assertTrue(published.get(0).timedOut());
        assertEquals("Task timed out after 1 seconds", published.get(0).errorMessage());
        runtime.close();
    }

    @Test
    @DisplayName("invalid job is reported without running the executor")
    void testInvalidJob() {
        AtomicInteger executions = new AtomicInteger();
        WorkerRuntime runtime = runtime((prompt, code, timeout) -> {
            executions.incrementAndGet();
            return new ExecutionResult(0, "", "");
        });

        assertThrows(ExecutionFailureException.class, () -> runtime.processJob(job("t1", " ", 10, 1, 3)));

        assertEquals(0, executions.get());
        assertEquals("Invalid job: prompt is required", published.get(0).errorMessage());
        assertEquals(0, published.get(0).executionTimeMs());
        runtime.close();
    }

    @Test
    @DisplayName("executor exception becomes a failed result")
    void testExecutorThrows() {
        WorkerRuntime runtime = runtime((prompt, code, timeout) -> {
            throw new IOException("cannot start shell");
        });

        ExecutionFailureException e = assertThrows(ExecutionFailureException.class,
                () -> runtime.processJob(job("t1", "x", 10, 1, 3)));

        assertEquals("cannot start shell", e.getMessage());
        assertEquals("cannot start shell", published.get(0).errorMessage());
        runtime.close();
    }

    @Test
    @DisplayName("a failing publisher never hides the execution failure")
    void testPublishFailureOnFailurePath() {
        WorkerRuntime runtime = new WorkerRuntime(config, jobSource,
                message -> {
                    throw new IllegalStateException("results channel down");
                },
                (workerId, type) -> {
                }, (prompt, code, timeout) -> new ExecutionResult(1, "", "real error"), () -> {
                });

        ExecutionFailureException e = assertThrows(ExecutionFailureException.class,
                () -> runtime.processJob(job("t1", "x", 10, 1, 3)));
        assertEquals("real error", e.getMessage());
        runtime.close();
    }

    @Test
    @DisplayName("slot loop acks successes, retries failures, and shuts down in order")
    void testSlotLoop() throws Exception {
        jobSource.jobs.add(job("ok", "echo ok", 10, 1, 3));
        jobSource.jobs.add(job("bad", "exit 1", 10, 1, 3));

        AtomicBoolean transportClosed = new AtomicBoolean(false);
        WorkerRuntime runtime = new WorkerRuntime(config.withSlots(2), jobSource, published::add,
                (workerId, type) -> heartbeats.add(workerId),
                (prompt, code, timeout) -> prompt.startsWith("echo")
                        ? new ExecutionResult(0, "ok", "")
                        : new ExecutionResult(1, "", "failed"),
                () -> transportClosed.set(true));

        runtime.start();
        assertTrue(runtime.isRunning());

        await(() -> jobSource.acks.size() == 1 && jobSource.retries.size() == 1, Duration.ofSeconds(10));
        await(() -> !heartbeats.isEmpty(), Duration.ofSeconds(5));

        runtime.stop();
        runtime.awaitTermination();

        assertFalse(runtime.isRunning());
        assertTrue(transportClosed.get());
        assertEquals(List.of("ok"), jobSource.acks);
        assertEquals(List.of("bad: failed"), jobSource.retries);
        assertEquals(SlotState.IDLE, runtime.slotState(0));
        assertEquals(SlotState.IDLE, runtime.slotState(1));
        assertEquals("worker-test", heartbeats.get(0));
    }

    @Test
    @DisplayName("claim errors do not stop the slot loop")
    void testClaimErrorsTolerated() throws Exception {
        jobSource.failNextClaims.set(3);
        jobSource.jobs.add(job("t1", "echo ok", 10, 1, 3));

        WorkerRuntime runtime = runtime((prompt, code, timeout) -> new ExecutionResult(0, "ok", ""));
        runtime.start();

        await(() -> jobSource.acks.size() == 1, Duration.ofSeconds(10));
        runtime.stop();
    }

    /**
     * Job source over an in-memory queue that records acks and retries.
     */
    private static final class RecordingJobSource implements JobSource {
        final ConcurrentLinkedQueue<ClaimedJob> jobs = new ConcurrentLinkedQueue<>();
        final List<String> acks = Collections.synchronizedList(new ArrayList<>());
        final List<String> retries = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger failNextClaims = new AtomicInteger();

        @Override
        public Optional<ClaimedJob> claim(String workerId) {
            if (failNextClaims.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("coordinator unreachable");
            }
            return Optional.ofNullable(jobs.poll());
        }

        @Override
        public void ack(String taskId, String workerId) {
            acks.add(taskId);
        }

        @Override
        public void retry(String taskId, String workerId, String error) {
            retries.add(taskId + ": " + error);
        }
    }
}
