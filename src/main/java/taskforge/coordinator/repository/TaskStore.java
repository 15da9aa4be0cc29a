package taskforge.coordinator.repository;

import taskforge.coordinator.model.NewTask;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskCursor;
import taskforge.coordinator.model.TaskStatus;
import taskforge.coordinator.model.TaskUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The only point of contact with durable task storage.
 * Implementations can use JDBC, JPA, or in-memory storage.
 */
public interface TaskStore {

    /**
     * Create a new QUEUED task with a fresh id and {@code createdAt}.
     *
     * @param task the submitted fields
     * @return the stored task
     */
    Task create(NewTask task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Apply a partial update.
     *
     * @param taskId the task ID
     * @param update fields to write; null fields are left untouched
     * @return the updated task, or empty if {@link TaskUpdate#expectedStatus()} no longer matched
     * @throws taskforge.exception.TaskNotFoundException if the task does not exist
     */
    Optional<Task> update(String taskId, TaskUpdate update);

    /**
     * Count tasks per status. Every status is present in the result.
     */
    Map<TaskStatus, Integer> countByStatus();

    /**
     * Delete a terminal task.
     *
     * @throws taskforge.exception.TaskNotFoundException    if the task does not exist
     * @throws taskforge.exception.TaskNotTerminalException if the task is QUEUED or RUNNING
     */
    void delete(String taskId);

    /**
     * Find tasks in a status created before the given instant, ordered by {@code (createdAt, id)}.
     * Used by the sweeper, which pages through with the cursor of the last row it saw.
     *
     * @param status        status to match
     * @param createdBefore exclusive upper bound on {@code createdAt}
     * @param after         resume after this position, or null to start from the oldest task
     * @param limit         maximum number of results
     */
    List<Task> findCreatedBefore(TaskStatus status, Instant createdBefore, TaskCursor after, int limit);

    /**
     * List tasks newest first.
     *
     * @param status filter, or null for every status
     * @param offset rows to skip
     * @param limit  maximum number of results
     */
    List<Task> list(TaskStatus status, int offset, int limit);
}
