package taskforge.coordinator.scheduler;

import taskforge.coordinator.config.CoordinatorConfig;
import taskforge.coordinator.liveness.LivenessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - DispatchSweeper: orphan re-enqueue, expired leases, retention purge
 * - registry prune: drops expired heartbeats
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final DispatchSweeper sweeper;
    private final LivenessRegistry registry;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(DispatchSweeper sweeper, LivenessRegistry registry, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskforge-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.sweeper = sweeper;
        this.registry = registry;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepIntervalMs = config.sweepInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("dispatch-sweeper", sweeper),
                sweepIntervalMs, // initial delay
                sweepIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Dispatch sweeper scheduled every {}ms", sweepIntervalMs);

        long pruneIntervalMs = config.registryPruneInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("registry-prune", registry::prune),
                pruneIntervalMs,
                pruneIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Registry prune scheduled every {}ms", pruneIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
