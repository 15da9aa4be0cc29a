package taskforge.coordinator.config;

import taskforge.coordinator.api.internal.v1.DispatchController;
import taskforge.coordinator.api.internal.v1.HeartbeatController;
import taskforge.coordinator.api.internal.v1.ResultController;
import taskforge.coordinator.api.v1.HealthController;
import taskforge.coordinator.api.v1.MonitoringController;
import taskforge.coordinator.api.v1.TaskController;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.RetentionPolicy;
import taskforge.coordinator.broker.RetryPolicy;
import taskforge.coordinator.liveness.InMemoryLivenessRegistry;
import taskforge.coordinator.liveness.LivenessRegistry;
import taskforge.coordinator.liveness.WorkerStatusPolicy;
import taskforge.coordinator.reconcile.ResultReconciler;
import taskforge.coordinator.reconcile.TaskStateMachine;
import taskforge.coordinator.repository.TaskStore;
import taskforge.coordinator.scheduler.DispatchSweeper;
import taskforge.coordinator.scheduler.Scheduler;
import taskforge.coordinator.server.RouterHandler;
import taskforge.coordinator.service.DispatchService;
import taskforge.coordinator.service.MonitoringService;
import taskforge.coordinator.service.SubmissionService;
import taskforge.coordinator.store.Database;
import taskforge.coordinator.store.JdbcJobBroker;
import taskforge.coordinator.store.JdbcTaskStore;
import taskforge.worker.ResultPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background sweeps
 * SubmissionService submissions = deps.submissionService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskStore taskStore;
    private final JobBroker jobBroker;
    private final LivenessRegistry livenessRegistry;
    private final ResultReconciler resultReconciler;
    private final SubmissionService submissionService;
    private final DispatchService dispatchService;
    private final MonitoringService monitoringService;
    private final DispatchSweeper dispatchSweeper;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final MonitoringController monitoringController;
    private final HeartbeatController heartbeatController;
    private final DispatchController dispatchController;
    private final ResultController resultController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Adapters
        this.taskStore = new JdbcTaskStore(database, clock);
        this.jobBroker = new JdbcJobBroker(database, clock,
                new RetryPolicy(config.defaultMaxAttempts(), config.backoffBaseDelay(), config.backoffMaxDelay()),
                new RetentionPolicy(config.completedRetentionAge(), config.completedRetentionCount(),
                        config.failedRetentionAge()),
                config.leaseGrace());
        this.livenessRegistry = new InMemoryLivenessRegistry(clock, config.heartbeatTtl());

        // Services
        this.resultReconciler = new ResultReconciler(taskStore, new TaskStateMachine(), clock);
        this.submissionService = new SubmissionService(taskStore, jobBroker);
        this.dispatchService = new DispatchService(jobBroker, resultReconciler);
        this.monitoringService = new MonitoringService(jobBroker, taskStore, livenessRegistry,
                new WorkerStatusPolicy(config.workerActiveThreshold(), config.workerIdleThreshold()), clock);
        this.dispatchSweeper = new DispatchSweeper(taskStore, jobBroker, dispatchService,
                config.orphanGracePeriod(), clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, monitoringService);
        this.taskController = new TaskController(submissionService, monitoringService);
        this.monitoringController = new MonitoringController(monitoringService);

        // Controllers (internal API)
        this.heartbeatController = new HeartbeatController(livenessRegistry);
        this.dispatchController = new DispatchController(dispatchService, jobBroker);
        this.resultController = new ResultController(resultReconciler);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the system clock.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with the given config and clock.
     */
    public static Dependencies create(CoordinatorConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public JobBroker jobBroker() {
        return jobBroker;
    }

    public LivenessRegistry livenessRegistry() {
        return livenessRegistry;
    }

    public ResultReconciler resultReconciler() {
        return resultReconciler;
    }

    public SubmissionService submissionService() {
        return submissionService;
    }

    public DispatchService dispatchService() {
        return dispatchService;
    }

    public MonitoringService monitoringService() {
        return monitoringService;
    }

    public DispatchSweeper dispatchSweeper() {
        return dispatchSweeper;
    }

    /**
     * Result publisher that applies results in-process, for workers embedded in the coordinator.
     */
    public ResultPublisher resultPublisher() {
        return resultReconciler::apply;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(monitoringController)
                    .registerController(heartbeatController)
                    .registerController(dispatchController)
                    .registerController(resultController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(dispatchSweeper, livenessRegistry, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for dispatch sweeps and registry pruning.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
