package taskforge.coordinator.broker;

/**
 * State of a dispatch record inside the broker.
 */
public enum BrokerState {
    WAITING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isLive() {
        return switch (this) {
            case WAITING, DELAYED, ACTIVE -> true;
            case COMPLETED, FAILED -> false;
        };
    }
}
