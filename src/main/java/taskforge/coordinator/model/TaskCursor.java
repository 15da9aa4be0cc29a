package taskforge.coordinator.model;

import java.time.Instant;

/**
 * Keyset position in a scan ordered by {@code (createdAt, id)}.
 */
public record TaskCursor(Instant createdAt, String id) {

    public static TaskCursor after(Task task) {
        return new TaskCursor(task.createdAt(), task.id());
    }
}
