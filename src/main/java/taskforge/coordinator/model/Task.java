package taskforge.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one submitted task.
 * Updates go through {@link TaskUpdate}; use {@link #toBuilder()} to derive copies.
 */
public final class Task {
    private final String id;
    private final TaskStatus status;
    private final String prompt;
    private final String code;
    private final int timeout;
    private final String workerId;
    private final String result;
    private final String errorMessage;
    private final Long executionTimeMs;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.prompt = Objects.requireNonNull(builder.prompt, "prompt is required");
        this.code = builder.code;
        this.timeout = builder.timeout;
        this.workerId = builder.workerId;
        this.result = builder.result;
        this.errorMessage = builder.errorMessage;
        this.executionTimeMs = builder.executionTimeMs;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public TaskStatus status() {
        return status;
    }

    public String prompt() {
        return prompt;
    }

    public String code() {
        return code;
    }

    public int timeout() {
        return timeout;
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

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .prompt(prompt)
                .code(code)
                .timeout(timeout)
                .workerId(workerId)
                .result(result)
                .errorMessage(errorMessage)
                .executionTimeMs(executionTimeMs)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskStatus status = TaskStatus.QUEUED;
        private String prompt;
        private String code;
        private int timeout = 300;
        private String workerId;
        private String result;
        private String errorMessage;
        private Long executionTimeMs;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder timeout(int timeout) {
            this.timeout = timeout;
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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
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

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", workerId='" + workerId + "'}";
    }
}
