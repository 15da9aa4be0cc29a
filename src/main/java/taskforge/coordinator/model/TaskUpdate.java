package taskforge.coordinator.model;

import java.time.Instant;

/**
 * Partial update of a task record. Null fields are left untouched.
 * <p>
 * When {@code expectedStatus} is set the update only applies if the stored
 * status still equals it, which lets two racing writers resolve to one winner.
 */
public final class TaskUpdate {
    private final TaskStatus expectedStatus;
    private final TaskStatus status;
    private final String workerId;
    private final String result;
    private final String errorMessage;
    private final Long executionTimeMs;
    private final Instant startedAt;
    private final Instant completedAt;

    private TaskUpdate(Builder builder) {
        this.expectedStatus = builder.expectedStatus;
        this.status = builder.status;
        this.workerId = builder.workerId;
        this.result = builder.result;
        this.errorMessage = builder.errorMessage;
        this.executionTimeMs = builder.executionTimeMs;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public TaskStatus expectedStatus() {
        return expectedStatus;
    }

    public TaskStatus status() {
        return status;
    }

    public String workerId() {
        return workerId;
    }

    public String result() {
        return result;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Long executionTimeMs() {
        return executionTimeMs;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isEmpty() {
        return status == null && workerId == null && result == null && errorMessage == null
                && executionTimeMs == null && startedAt == null && completedAt == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TaskStatus expectedStatus;
        private TaskStatus status;
        private String workerId;
        private String result;
        private String errorMessage;
        private Long executionTimeMs;
        private Instant startedAt;
        private Instant completedAt;

        public Builder expectedStatus(TaskStatus expectedStatus) {
            this.expectedStatus = expectedStatus;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder executionTimeMs(Long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public TaskUpdate build() {
            return new TaskUpdate(this);
        }
    }
}
