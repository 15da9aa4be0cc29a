package taskforge.coordinator.broker;

import java.time.Duration;

/**
 * Exponential backoff for failed dispatch attempts.
 * <p>
 * Invariants:
 * - maxAttempts >= 1
 * - baseDelay >= 0
 * - maxDelay >= baseDelay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    /**
     * Default policy: 3 attempts, 2s base delay doubling per attempt, capped at 5 minutes.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofMinutes(5));
    }

    /**
     * Backoff before the next attempt, after {@code attemptNumber} attempts have failed.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // baseDelay * 2^(attempt - 1), capped; the exponent is clamped to keep the shift in range
        int exponent = Math.min(attemptNumber - 1, 30);
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        long delayMs = baseMs > (maxMs >> exponent) ? maxMs : baseMs << exponent;

        return Duration.ofMillis(Math.min(delayMs, maxMs));
    }

    public boolean hasMoreAttempts(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
