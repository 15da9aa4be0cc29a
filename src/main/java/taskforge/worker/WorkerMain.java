package taskforge.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Worker process entry point.
 * Options override the corresponding environment variables.
 */
@Command(
        name = "taskforge-worker",
        mixinStandardHelpOptions = true,
        description = "Claims tasks from a TaskForge coordinator and executes them")
public final class WorkerMain implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    @Option(names = {"--id"}, description = "Worker identity (env WORKER_ID)")
    String workerId;

    @Option(names = {"--type"}, description = "Worker type: local|cloud (env WORKER_TYPE)")
    String workerType;

    @Option(names = {"--coordinator"}, description = "Coordinator base URL (env TASKFORGE_COORDINATOR_URL)")
    String coordinatorUrl;

    @Option(names = {"--slots"}, description = "Concurrent job slots (env TASKFORGE_WORKER_SLOTS)")
    Integer slots;

    @Option(names = {"--heartbeat-interval"}, description = "Heartbeat interval in seconds", defaultValue = "10")
    int heartbeatIntervalSeconds;

    @Option(names = {"--shell"}, description = "Shell used to run task commands", defaultValue = "sh")
    String shell;

    public static void main(String[] args) {
        int code = new CommandLine(new WorkerMain()).execute(args);
        System.exit(code);
    }

    /**
     * Environment configuration with command-line overrides applied.
     */
    WorkerConfig resolveConfig() {
        WorkerConfig config = WorkerConfig.fromEnv();
        if (workerId != null && !workerId.isBlank()) {
            config.withWorkerId(workerId);
        }
        if (workerType != null && !workerType.isBlank()) {
            if (!"local".equals(workerType) && !"cloud".equals(workerType)) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                        "--type must be 'local' or 'cloud'");
            }
            config.withWorkerType(workerType);
        }
        if (coordinatorUrl != null && !coordinatorUrl.isBlank()) {
            config.withCoordinatorUrl(coordinatorUrl);
        }
        if (slots != null) {
            config.withSlots(slots);
        }
        return config.withHeartbeatInterval(Duration.ofSeconds(heartbeatIntervalSeconds));
    }

    @Override
    public Integer call() throws Exception {
        WorkerConfig config = resolveConfig();

        CoordinatorClient client = new CoordinatorClient(config);
        WorkerRuntime runtime = new WorkerRuntime(config, client, client, client,
                new ShellTaskExecutor(List.of(shell, "-c")), client);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested for worker {}", config.workerId());
            runtime.stop();
        }, "taskforge-worker-shutdown"));

        runtime.start();
        runtime.awaitTermination();
        return 0;
    }
}
