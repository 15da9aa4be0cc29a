package taskforge.worker;

import taskforge.protocol.ResultMessage;

/**
 * Delivers result messages to the coordinator's reconciler.
 */
@FunctionalInterface
public interface ResultPublisher {

    void publish(ResultMessage message);
}
