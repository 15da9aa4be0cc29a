package taskforge.worker;

import java.time.Duration;

/**
 * Configuration holder for a worker process.
 * All settings have sensible defaults; {@link #fromEnv()} applies environment overrides.
 */
public final class WorkerConfig {

    private String workerId = "worker-" + ProcessHandle.current().pid();
    private String workerType = "local";
    private String coordinatorUrl = "http://localhost:3000";
    private String workerKey = null; // Sent as X-TaskForge-Key when set

    private int slots = 1;
    private Duration heartbeatInterval = Duration.ofSeconds(10);
    private Duration idleSleep = Duration.ofMillis(500);
    private Duration requestTimeout = Duration.ofSeconds(10);
    private Duration shutdownTimeout = Duration.ofMinutes(65);

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();

        String url = System.getenv("TASKFORGE_COORDINATOR_URL");
        if (url != null && !url.isBlank()) {
            config.coordinatorUrl = url;
        }

        String id = System.getenv("WORKER_ID");
        if (id != null && !id.isBlank()) {
            config.workerId = id;
        }

        String type = System.getenv("WORKER_TYPE");
        if (type != null && !type.isBlank()) {
            config.workerType = type;
        }

        String key = System.getenv("TASKFORGE_WORKER_KEY");
        if (key != null && !key.isBlank()) {
            config.workerKey = key;
        }

        String slots = System.getenv("TASKFORGE_WORKER_SLOTS");
        if (slots != null && !slots.isBlank()) {
            config.slots = Integer.parseInt(slots);
        }

        return config;
    }

    public String workerId() {
        return workerId;
    }

    public String workerType() {
        return workerType;
    }

    public String coordinatorUrl() {
        return coordinatorUrl;
    }

    public String workerKey() {
        return workerKey;
    }

    public boolean hasWorkerKey() {
        return workerKey != null && !workerKey.isBlank();
    }

    public int slots() {
        return slots;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration idleSleep() {
        return idleSleep;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    // Fluent setters for CLI overrides and tests
    public WorkerConfig withWorkerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    public WorkerConfig withWorkerType(String workerType) {
        this.workerType = workerType;
        return this;
    }

    public WorkerConfig withCoordinatorUrl(String coordinatorUrl) {
        this.coordinatorUrl = coordinatorUrl;
        return this;
    }

    public WorkerConfig withWorkerKey(String workerKey) {
        this.workerKey = workerKey;
        return this;
    }

    public WorkerConfig withSlots(int slots) {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1");
        }
        this.slots = slots;
        return this;
    }

    public WorkerConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public WorkerConfig withIdleSleep(Duration idleSleep) {
        this.idleSleep = idleSleep;
        return this;
    }

    public WorkerConfig withShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "workerId='" + workerId + '\'' +
                ", type='" + workerType + '\'' +
                ", coordinatorUrl='" + coordinatorUrl + '\'' +
                ", slots=" + slots +
                ", workerKeySet=" + hasWorkerKey() +
                '}';
    }
}
