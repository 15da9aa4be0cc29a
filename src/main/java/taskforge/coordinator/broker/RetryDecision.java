package taskforge.coordinator.broker;

import java.time.Duration;

/**
 * What the broker did with a failed attempt.
 *
 * @param outcome  retry scheduled, moved to the failed bucket, or unknown record
 * @param delay    backoff before the record becomes eligible again; zero unless retried
 * @param attempts attempts made so far
 */
public record RetryDecision(Outcome outcome, Duration delay, int attempts) {

    public enum Outcome {
        RETRY_SCHEDULED,
        DEAD_LETTERED,
        NOT_ACTIVE
    }

    public static RetryDecision scheduled(Duration delay, int attempts) {
        return new RetryDecision(Outcome.RETRY_SCHEDULED, delay, attempts);
    }

    public static RetryDecision deadLettered(int attempts) {
        return new RetryDecision(Outcome.DEAD_LETTERED, Duration.ZERO, attempts);
    }

    public static RetryDecision notActive() {
        return new RetryDecision(Outcome.NOT_ACTIVE, Duration.ZERO, 0);
    }

    public boolean isDeadLettered() {
        return outcome == Outcome.DEAD_LETTERED;
    }
}
