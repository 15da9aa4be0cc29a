package taskforge.coordinator.service;

import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.QueueStats;
import taskforge.coordinator.liveness.HeartbeatRecord;
import taskforge.coordinator.liveness.LivenessRegistry;
import taskforge.coordinator.liveness.WorkerStatusPolicy;
import taskforge.coordinator.liveness.WorkerView;
import taskforge.coordinator.repository.TaskStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only views over the broker, the task store and the liveness registry.
 * The three sources are read independently and may disagree briefly.
 */
public class MonitoringService {

    private final JobBroker broker;
    private final TaskStore taskStore;
    private final LivenessRegistry registry;
    private final WorkerStatusPolicy statusPolicy;
    private final Clock clock;

    public MonitoringService(JobBroker broker, TaskStore taskStore, LivenessRegistry registry,
            WorkerStatusPolicy statusPolicy, Clock clock) {
        this.broker = broker;
        this.taskStore = taskStore;
        this.registry = registry;
        this.statusPolicy = statusPolicy;
        this.clock = clock;
    }

    public QueueStats getQueueStats() {
        return broker.stats();
    }

    /**
     * Workers with a recent heartbeat. Stale workers are left out.
     */
    public List<WorkerView> getWorkerList() {
        Instant now = clock.instant();
        List<WorkerView> workers = new ArrayList<>();
        for (HeartbeatRecord record : registry.list()) {
            statusPolicy.view(record, now).ifPresent(workers::add);
        }
        return workers;
    }

    public TaskStats getTaskStats() {
        return TaskStats.from(taskStore.countByStatus());
    }
}
