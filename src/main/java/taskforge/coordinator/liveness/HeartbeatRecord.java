package taskforge.coordinator.liveness;

import java.time.Instant;

/**
 * Last heartbeat seen from one worker. Expires at {@code expiresAt}.
 */
public record HeartbeatRecord(String workerId, String type, Instant lastSeen, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
