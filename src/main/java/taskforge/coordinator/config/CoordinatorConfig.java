package taskforge.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskforge;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 3000;
    private String serverHost = "0.0.0.0";

    // Broker settings
    private int defaultMaxAttempts = 3;
    private Duration backoffBaseDelay = Duration.ofSeconds(2);
    private Duration backoffMaxDelay = Duration.ofMinutes(5);
    private Duration leaseGrace = Duration.ofSeconds(30);
    private Duration completedRetentionAge = Duration.ofHours(1);
    private int completedRetentionCount = 1000;
    private Duration failedRetentionAge = Duration.ofHours(24);

    // Sweeper settings
    private Duration orphanGracePeriod = Duration.ofSeconds(60);
    private Duration sweepInterval = Duration.ofSeconds(30);

    // Liveness settings
    private Duration heartbeatTtl = Duration.ofSeconds(30);
    private Duration workerActiveThreshold = Duration.ofSeconds(15);
    private Duration workerIdleThreshold = Duration.ofSeconds(30);
    private Duration registryPruneInterval = Duration.ofSeconds(5);

    // Auth settings (optional)
    private String workerKey = null; // If set, workers must provide X-TaskForge-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("TASKFORGE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("TASKFORGE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workerKey = System.getenv("TASKFORGE_WORKER_KEY");
        if (workerKey != null && !workerKey.isBlank()) {
            config.workerKey = workerKey;
        }

        String maxAttempts = System.getenv("TASKFORGE_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String backoffMs = System.getenv("TASKFORGE_BACKOFF_MS");
        if (backoffMs != null && !backoffMs.isBlank()) {
            config.backoffBaseDelay = Duration.ofMillis(Long.parseLong(backoffMs));
        }

        String sweepSeconds = System.getenv("TASKFORGE_SWEEP_INTERVAL_SECONDS");
        if (sweepSeconds != null && !sweepSeconds.isBlank()) {
            config.sweepInterval = Duration.ofSeconds(Long.parseLong(sweepSeconds));
        }

        return config;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public Duration backoffBaseDelay() {
        return backoffBaseDelay;
    }

    public Duration backoffMaxDelay() {
        return backoffMaxDelay;
    }

    public Duration leaseGrace() {
        return leaseGrace;
    }

    public Duration completedRetentionAge() {
        return completedRetentionAge;
    }

    public int completedRetentionCount() {
        return completedRetentionCount;
    }

    public Duration failedRetentionAge() {
        return failedRetentionAge;
    }

    public Duration orphanGracePeriod() {
        return orphanGracePeriod;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public Duration heartbeatTtl() {
        return heartbeatTtl;
    }

    public Duration workerActiveThreshold() {
        return workerActiveThreshold;
    }

    public Duration workerIdleThreshold() {
        return workerIdleThreshold;
    }

    public Duration registryPruneInterval() {
        return registryPruneInterval;
    }

    public String workerKey() {
        return workerKey;
    }

    public boolean hasWorkerKey() {
        return workerKey != null && !workerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withWorkerKey(String key) {
        this.workerKey = key;
        return this;
    }

    public CoordinatorConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public CoordinatorConfig withBackoff(Duration baseDelay, Duration maxDelay) {
        this.backoffBaseDelay = baseDelay;
        this.backoffMaxDelay = maxDelay;
        return this;
    }

    public CoordinatorConfig withLeaseGrace(Duration leaseGrace) {
        this.leaseGrace = leaseGrace;
        return this;
    }

    public CoordinatorConfig withRetention(Duration completedAge, int completedCount, Duration failedAge) {
        this.completedRetentionAge = completedAge;
        this.completedRetentionCount = completedCount;
        this.failedRetentionAge = failedAge;
        return this;
    }

    public CoordinatorConfig withOrphanGracePeriod(Duration gracePeriod) {
        this.orphanGracePeriod = gracePeriod;
        return this;
    }

    public CoordinatorConfig withSweepInterval(Duration interval) {
        this.sweepInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkerThresholds(Duration active, Duration idle, Duration ttl) {
        this.workerActiveThreshold = active;
        this.workerIdleThreshold = idle;
        this.heartbeatTtl = ttl;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxAttempts=" + defaultMaxAttempts +
                ", backoffBase=" + backoffBaseDelay +
                ", workerKeySet=" + hasWorkerKey() +
                '}';
    }
}
