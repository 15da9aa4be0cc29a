package taskforge.coordinator.scheduler;

import taskforge.coordinator.broker.ActiveJob;
import taskforge.coordinator.broker.EnqueueResult;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskCursor;
import taskforge.coordinator.model.TaskStatus;
import taskforge.coordinator.repository.TaskStore;
import taskforge.coordinator.service.DispatchService;
import taskforge.protocol.DispatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Background recovery of dispatch records.
 * <p>
 * Each run:
 * 1. Re-enqueues QUEUED tasks older than the grace period that have no live broker record
 *    (the broker was down at submission time)
 * 2. Retries ACTIVE broker records whose lease expired (the worker died mid-job);
 *    the retry may dead-letter the job and fail the task
 * 3. Fails RUNNING tasks whose broker record is dead-lettered or gone
 * 4. Purges finished broker records beyond retention
 * <p>
 * Task scans page through the store with a keyset cursor that persists across runs,
 * so tasks that need no action never hide the ones behind them.
 * Every step catches its own errors so one failing step never blocks the others.
 */
public class DispatchSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchSweeper.class);

    static final String LEASE_EXPIRED_ERROR = "Worker lease expired";

    static final int SCAN_BATCH_SIZE = 100;
    static final int MAX_PAGES_PER_RUN = 10;

    private final TaskStore taskStore;
    private final JobBroker broker;
    private final DispatchService dispatchService;
    private final Duration orphanGracePeriod;
    private final Clock clock;

    // Touched only by the scheduler thread
    private TaskCursor orphanCursor;
    private TaskCursor strandedCursor;

    public DispatchSweeper(TaskStore taskStore, JobBroker broker, DispatchService dispatchService,
            Duration orphanGracePeriod, Clock clock) {
        this.taskStore = taskStore;
        this.broker = broker;
        this.dispatchService = dispatchService;
        this.orphanGracePeriod = orphanGracePeriod;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            requeueOrphans();
        } catch (Exception e) {
            log.error("Orphan sweep error", e);
        }
        try {
            recoverExpiredLeases();
        } catch (Exception e) {
            log.error("Lease sweep error", e);
        }
        try {
            failStrandedTasks();
        } catch (Exception e) {
            log.error("Stranded task sweep error", e);
        }
        try {
            broker.purgeFinished();
        } catch (Exception e) {
            log.error("Retention purge error", e);
        }
    }

    /**
     * Re-enqueue QUEUED tasks that never reached the broker.
     *
     * @return number of tasks enqueued
     */
    public int requeueOrphans() {
        Instant cutoff = clock.instant().minus(orphanGracePeriod);
        ScanResult scan = scan(TaskStatus.QUEUED, cutoff, orphanCursor, task -> {
            if (broker.isLive(task.id())) {
                return false;
            }
            DispatchMessage message = new DispatchMessage(task.id(), task.prompt(), task.code(), task.timeout());
            if (broker.enqueue(message) == EnqueueResult.ENQUEUED) {
                log.info("Re-enqueued orphaned task {} (created {})", task.id(), task.createdAt());
                return true;
            }
            return false;
        });
        orphanCursor = scan.resumeAfter();

        if (scan.acted() > 0) {
            log.info("Orphan sweep: {} re-enqueued of {} scanned", scan.acted(), scan.scanned());
        }
        return scan.acted();
    }

    /**
     * Fail RUNNING tasks that no worker will ever report on: the broker dead-lettered
     * the job or dropped its record, but the task update never landed.
     *
     * @return number of tasks failed
     */
    public int failStrandedTasks() {
        Instant cutoff = clock.instant().minus(orphanGracePeriod);
        ScanResult scan = scan(TaskStatus.RUNNING, cutoff, strandedCursor, task -> {
            if (dispatchService.failIfStranded(task.id(), task.workerId())) {
                log.warn("Failed stranded task {} (worker {})", task.id(), task.workerId());
                return true;
            }
            return false;
        });
        strandedCursor = scan.resumeAfter();

        if (scan.acted() > 0) {
            log.info("Stranded task sweep: {} failed of {} scanned", scan.acted(), scan.scanned());
        }
        return scan.acted();
    }

    /**
     * Retry active jobs whose lease deadline passed.
     *
     * @return number of leases recovered
     */
    public int recoverExpiredLeases() {
        List<ActiveJob> expired = broker.findExpiredLeases(clock.instant());
        if (expired.isEmpty()) {
            log.debug("No expired leases found");
            return 0;
        }

        int retried = 0;
        int failed = 0;
        for (ActiveJob job : expired) {
            try {
                RetryDecision decision = dispatchService.reportFailure(job.taskId(), job.workerId(), LEASE_EXPIRED_ERROR);
                switch (decision.outcome()) {
                    case RETRY_SCHEDULED -> retried++;
                    case DEAD_LETTERED -> failed++;
                    case NOT_ACTIVE -> log.debug("Lease for task {} already released", job.taskId());
                }
            } catch (Exception e) {
                log.error("Failed to recover lease for task {}", job.taskId(), e);
            }
        }

        log.info("Lease sweep: {} retried, {} failed, {} total expired", retried, failed, expired.size());
        return retried + failed;
    }

    /**
     * Walk tasks in a status, starting after {@code from}, for at most {@link #MAX_PAGES_PER_RUN} pages.
     * A short page means the scan reached the end and the next run starts over.
     */
    private ScanResult scan(TaskStatus status, Instant cutoff, TaskCursor from, Predicate<Task> action) {
        TaskCursor cursor = from;
        int scanned = 0;
        int acted = 0;

        for (int page = 0; page < MAX_PAGES_PER_RUN; page++) {
            List<Task> batch = taskStore.findCreatedBefore(status, cutoff, cursor, SCAN_BATCH_SIZE);
            for (Task task : batch) {
                try {
                    if (action.test(task)) {
                        acted++;
                    }
                } catch (Exception e) {
                    log.error("Sweep of {} task {} failed", status, task.id(), e);
                }
            }
            scanned += batch.size();

            if (batch.size() < SCAN_BATCH_SIZE) {
                return new ScanResult(null, scanned, acted);
            }
            cursor = TaskCursor.after(batch.get(batch.size() - 1));
        }
        return new ScanResult(cursor, scanned, acted);
    }

    private record ScanResult(TaskCursor resumeAfter, int scanned, int acted) {
    }
}
