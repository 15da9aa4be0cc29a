package taskforge.coordinator.broker;

import java.time.Duration;

/**
 * How long finished dispatch records are kept for diagnostics.
 *
 * @param completedMaxAge   completed records older than this are purged
 * @param completedMaxCount at most this many completed records are kept (newest first)
 * @param failedMaxAge      failed records older than this are purged
 */
public record RetentionPolicy(Duration completedMaxAge, int completedMaxCount, Duration failedMaxAge) {

    public static RetentionPolicy defaultPolicy() {
        return new RetentionPolicy(Duration.ofHours(1), 1000, Duration.ofHours(24));
    }
}
