package taskforge.worker;

/**
 * Receives worker liveness pings.
 */
public interface HeartbeatSink {

    /**
     * Record that the worker is alive now.
     *
     * @param workerId worker identity
     * @param type     "local" or "cloud"; may be null
     */
    void heartbeat(String workerId, String type);
}
