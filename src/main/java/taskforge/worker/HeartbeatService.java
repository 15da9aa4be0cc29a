package taskforge.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sends heartbeats on its own timer, independent of job processing.
 * The first beat goes out immediately; failures are logged and never stop the timer.
 */
public class HeartbeatService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final HeartbeatSink sink;
    private final String workerId;
    private final String workerType;
    private final Duration interval;
    private final ScheduledExecutorService timer;

    private volatile boolean running = false;

    public HeartbeatService(HeartbeatSink sink, String workerId, String workerType, Duration interval) {
        this.sink = sink;
        this.workerId = workerId;
        this.workerType = workerType;
        this.interval = interval;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskforge-heartbeat-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        timer.scheduleAtFixedRate(this::beat, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Heartbeat started for {} every {}ms", workerId, interval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Heartbeat timer for {} did not stop in time", workerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Heartbeat stopped for {}", workerId);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void beat() {
        try {
            sink.heartbeat(workerId, workerType);
        } catch (Exception e) {
            log.warn("Heartbeat for {} failed: {}", workerId, e.getMessage());
        }
    }
}
