package taskforge.worker;

import taskforge.exception.ExecutionFailureException;
import taskforge.exception.ExecutionTimeoutException;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.ResultMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;

/**
 * Worker process core: a fixed number of slots, each looping claim, execute, report.
 * <p>
 * Each slot handles one job at a time. The executor runs on a separate thread so the
 * task deadline can be enforced regardless of what the executor does. Every attempt
 * produces a result message; success is acked, failure is handed back for retry.
 * <p>
 * Shutdown order: stop claiming, drain in-flight jobs, stop heartbeats, close the transport.
 */
public class WorkerRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private final WorkerConfig config;
    private final JobSource jobSource;
    private final ResultPublisher publisher;
    private final TaskExecutor executor;
    private final HeartbeatService heartbeatService;
    private final AutoCloseable transport;

    private final ExecutorService executionPool;
    private final AtomicReferenceArray<SlotState> slotStates;
    private final List<Thread> slotThreads = new ArrayList<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running = false;
    private volatile boolean stopped = false;

    /**
     * @param transport closed last on shutdown; pass {@code () -> {}} when nothing needs closing
     */
    public WorkerRuntime(WorkerConfig config, JobSource jobSource, ResultPublisher publisher,
            HeartbeatSink heartbeatSink, TaskExecutor executor, AutoCloseable transport) {
        this.config = config;
        this.jobSource = jobSource;
        this.publisher = publisher;
        this.executor = executor;
        this.transport = transport;
        this.heartbeatService = new HeartbeatService(heartbeatSink, config.workerId(), config.workerType(),
                config.heartbeatInterval());

        AtomicInteger threadCounter = new AtomicInteger();
        this.executionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskforge-exec-" + config.workerId() + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.slotStates = new AtomicReferenceArray<>(config.slots());
        for (int i = 0; i < config.slots(); i++) {
            slotStates.set(i, SlotState.IDLE);
        }
    }

    /**
     * Start heartbeats and the slot loops. Returns immediately.
     */
    public synchronized void start() {
        if (running || stopped) {
            log.warn("Worker {} already started", config.workerId());
            return;
        }
        running = true;

        heartbeatService.start();

        for (int i = 0; i < config.slots(); i++) {
            int slot = i;
            Thread t = new Thread(() -> slotLoop(slot), "taskforge-slot-" + config.workerId() + "-" + slot);
            t.setDaemon(true);
            slotThreads.add(t);
            t.start();
        }

        log.info("Worker started: {}", config);
    }

    /**
     * Graceful shutdown. In-flight jobs finish (bounded by their own deadlines
     * and the configured shutdown timeout) before the transport is closed.
     */
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
        }
        log.info("Worker {} stopping, waiting for in-flight jobs...", config.workerId());

        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (Thread t : slotThreads) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (remainingMs > 0) {
                    t.join(remainingMs);
                }
                if (t.isAlive()) {
                    log.warn("Slot {} did not drain before shutdown timeout", t.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        heartbeatService.stop();
        executionPool.shutdownNow();

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport: {}", e.getMessage());
        }

        terminated.countDown();
        log.info("Worker {} stopped", config.workerId());
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Block until {@link #stop()} has completed.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean isRunning() {
        return running;
    }

    public String workerId() {
        return config.workerId();
    }

    public SlotState slotState(int slot) {
        return slotStates.get(slot);
    }

    /**
     * Execute one claimed job and publish its result.
     *
     * @throws ExecutionFailureException if the attempt failed, including invalid jobs
     * @throws ExecutionTimeoutException if the deadline expired
     */
    public void processJob(ClaimedJob job) {
        processJob(job, state -> {
        });
    }

    // Slot loop

    private void slotLoop(int slot) {
        String workerId = config.workerId();
        log.debug("Slot {} of {} started", slot, workerId);

        while (running) {
            slotStates.set(slot, SlotState.IDLE);

            Optional<ClaimedJob> claimed;
            try {
                claimed = jobSource.claim(workerId);
            } catch (Exception e) {
                log.warn("Claim failed for {}: {}", workerId, e.getMessage());
                if (!idle()) {
                    break;
                }
                continue;
            }

            if (claimed.isEmpty()) {
                if (!idle()) {
                    break;
                }
                continue;
            }

            ClaimedJob job = claimed.get();
            slotStates.set(slot, SlotState.CLAIMED);
            handle(job, state -> slotStates.set(slot, state));
        }

        slotStates.set(slot, SlotState.IDLE);
        log.debug("Slot {} of {} stopped", slot, workerId);
    }

    private void handle(ClaimedJob job, Consumer<SlotState> stateListener) {
        String workerId = config.workerId();
        try {
            processJob(job, stateListener);
        } catch (RuntimeException e) {
            stateListener.accept(SlotState.REPORTING);
            log.warn("Task {} attempt {} failed: {}", job.taskId(), job.attempt(), e.getMessage());
            try {
                jobSource.retry(job.taskId(), workerId, e.getMessage());
            } catch (Exception retryError) {
                log.error("Failed to report failure of task {}; the lease will expire instead",
                        job.taskId(), retryError);
            }
            return;
        }

        try {
            jobSource.ack(job.taskId(), workerId);
        } catch (Exception e) {
            // The result is already applied; a redelivery is skipped by the dispatch path
            log.error("Failed to ack task {}", job.taskId(), e);
        }
    }

    private boolean idle() {
        try {
            Thread.sleep(config.idleSleep().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Job processing

    private void processJob(ClaimedJob job, Consumer<SlotState> stateListener) {
        String workerId = config.workerId();

        String invalid = validate(job);
        if (invalid != null) {
            stateListener.accept(SlotState.REPORTING);
            publishQuietly(ResultMessage.failed(job, workerId, invalid, 0));
            throw new ExecutionFailureException(invalid);
        }

        int timeoutSeconds = job.timeout() > 0 ? job.timeout() : DEFAULT_TIMEOUT_SECONDS;
        stateListener.accept(SlotState.EXECUTING);
        log.info("Executing task {} (attempt {}/{}, timeout {}s)",
                job.taskId(), job.attempt(), job.maxAttempts(), timeoutSeconds);

        long startNanos = System.nanoTime();
        Future<ExecutionResult> future = executionPool.submit(
                () -> executor.execute(job.prompt(), job.code(), timeoutSeconds));

        ExecutionResult result;
        try {
            result = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsedMs = elapsedMs(startNanos);
            stateListener.accept(SlotState.REPORTING);
            ExecutionTimeoutException timeout = new ExecutionTimeoutException(timeoutSeconds, e);
            publishQuietly(ResultMessage.timedOut(job, workerId, timeout.getMessage(), elapsedMs));
            throw timeout;
        } catch (ExecutionException e) {
            long elapsedMs = elapsedMs(startNanos);
            stateListener.accept(SlotState.REPORTING);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            publishQuietly(ResultMessage.failed(job, workerId, error, elapsedMs));
            throw new ExecutionFailureException(error, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            long elapsedMs = elapsedMs(startNanos);
            stateListener.accept(SlotState.REPORTING);
            publishQuietly(ResultMessage.failed(job, workerId, "Worker interrupted", elapsedMs));
            throw new ExecutionFailureException("Worker interrupted", e);
        }

        long elapsedMs = elapsedMs(startNanos);
        stateListener.accept(SlotState.REPORTING);

        if (result.timedOut()) {
            ExecutionTimeoutException timeout = new ExecutionTimeoutException(timeoutSeconds, null);
            publishQuietly(ResultMessage.timedOut(job, workerId, timeout.getMessage(), elapsedMs));
            throw timeout;
        }

        if (!result.isSuccess()) {
            String error = result.errorMessage();
            publishQuietly(ResultMessage.failed(job, workerId, error, elapsedMs));
            throw new ExecutionFailureException(error);
        }

        try {
            publisher.publish(ResultMessage.completed(job, workerId, result.stdout(), elapsedMs));
        } catch (RuntimeException e) {
            log.error("Failed to publish result of task {}", job.taskId(), e);
            throw new ExecutionFailureException("Failed to publish result: " + e.getMessage(), e);
        }
        log.info("Task {} completed in {}ms", job.taskId(), elapsedMs);
    }

    /**
     * Publish a failure result. A publish error is logged and never replaces the execution failure.
     */
    private void publishQuietly(ResultMessage message) {
        try {
            publisher.publish(message);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} result of task {}: {}",
                    message.status().wireName(), message.taskId(), e.getMessage());
        }
    }

    private static String validate(ClaimedJob job) {
        if (job.taskId() == null || job.taskId().isBlank()) {
            return "Invalid job: taskId is required";
        }
        if (job.prompt() == null || job.prompt().isBlank()) {
            return "Invalid job: prompt is required";
        }
        return null;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
