package taskforge.coordinator.store;

import taskforge.coordinator.model.NewTask;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskCursor;
import taskforge.coordinator.model.TaskStatus;
import taskforge.coordinator.model.TaskUpdate;
import taskforge.coordinator.repository.TaskStore;
import taskforge.exception.TaskNotFoundException;
import taskforge.exception.TaskNotTerminalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of TaskStore.
 * Last write wins; the only guard is the optional expected-status check on update.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private final Database db;
    private final Clock clock;

    public JdbcTaskStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Task create(NewTask newTask) {
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .status(TaskStatus.QUEUED)
                .prompt(newTask.prompt())
                .code(newTask.code())
                .timeout(newTask.timeout())
                .createdAt(clock.instant())
                .build();

        String sql = """
                    INSERT INTO tasks (id, status, prompt, code, timeout_seconds, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.status().name());
            ps.setString(3, task.prompt());
            ps.setString(4, task.code());
            ps.setInt(5, task.timeout());
            setTimestamp(ps, 6, task.createdAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Created task {}", task.id());
            return task;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create task", e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Optional<Task> update(String taskId, TaskUpdate update) {
        if (update.isEmpty()) {
            Task current = findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (update.expectedStatus() != null && current.status() != update.expectedStatus()) {
                return Optional.empty();
            }
            return Optional.of(current);
        }

        List<String> assignments = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        if (update.status() != null) {
            assignments.add("status = ?");
            values.add(update.status().name());
        }
        if (update.workerId() != null) {
            assignments.add("worker_id = ?");
            values.add(update.workerId());
        }
        if (update.result() != null) {
            assignments.add("result = ?");
            values.add(update.result());
        }
        if (update.errorMessage() != null) {
            assignments.add("error_message = ?");
            values.add(update.errorMessage());
        }
        if (update.executionTimeMs() != null) {
            assignments.add("execution_time_ms = ?");
            values.add(update.executionTimeMs());
        }
        if (update.startedAt() != null) {
            assignments.add("started_at = ?");
            values.add(Timestamp.from(update.startedAt()));
        }
        if (update.completedAt() != null) {
            assignments.add("completed_at = ?");
            values.add(Timestamp.from(update.completedAt()));
        }

        StringBuilder sql = new StringBuilder("UPDATE tasks SET ")
                .append(String.join(", ", assignments))
                .append(" WHERE id = ?");
        values.add(taskId);
        if (update.expectedStatus() != null) {
            sql.append(" AND status = ?");
            values.add(update.expectedStatus().name());
        }

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < values.size(); i++) {
                    ps.setObject(i + 1, values.get(i));
                }

                int updated = ps.executeUpdate();
                if (updated == 0) {
                    conn.rollback();
                    if (findById(conn, taskId).isEmpty()) {
                        throw new TaskNotFoundException(taskId);
                    }
                    log.debug("Update of task {} skipped, status is no longer {}", taskId, update.expectedStatus());
                    return Optional.empty();
                }

                Optional<Task> result = findById(conn, taskId);
                conn.commit();
                return result;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task: " + taskId, e);
        }
    }

    @Override
    public Map<TaskStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM tasks GROUP BY status";

        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    @Override
    public void delete(String taskId) {
        String sql = """
                    DELETE FROM tasks
                    WHERE id = ? AND status IN ('COMPLETED', 'FAILED', 'TIMEOUT')
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                int deleted = ps.executeUpdate();

                if (deleted == 0) {
                    conn.rollback();
                    Task current = findById(conn, taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
                    throw new TaskNotTerminalException(taskId, current.status());
                }

                conn.commit();
                log.info("Deleted task {}", taskId);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findCreatedBefore(TaskStatus status, Instant createdBefore, TaskCursor after, int limit) {
        String sql = after == null
                ? """
                    SELECT * FROM tasks
                    WHERE status = ? AND created_at < ?
                    ORDER BY created_at, id
                    LIMIT ?
                """
                : """
                    SELECT * FROM tasks
                    WHERE status = ? AND created_at < ?
                      AND (created_at > ? OR (created_at = ? AND id > ?))
                    ORDER BY created_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, status.name());
            setTimestamp(ps, i++, createdBefore);
            if (after != null) {
                setTimestamp(ps, i++, after.createdAt());
                setTimestamp(ps, i++, after.createdAt());
                ps.setString(i++, after.id());
            }
            ps.setInt(i, limit);

            return queryTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + status + " tasks", e);
        }
    }

    @Override
    public List<Task> list(TaskStatus status, int offset, int limit) {
        String sql = status == null
                ? "SELECT * FROM tasks ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?"
                : "SELECT * FROM tasks WHERE status = ? ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i++, limit);
            ps.setInt(i, offset);

            return queryTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    // Helper methods

    private List<Task> queryTasks(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Optional<Task> findById(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM tasks WHERE id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        }
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .prompt(rs.getString("prompt"))
                .code(rs.getString("code"))
                .timeout(rs.getInt("timeout_seconds"))
                .workerId(rs.getString("worker_id"))
                .result(rs.getString("result"))
                .errorMessage(rs.getString("error_message"))
                .executionTimeMs(getLongOrNull(rs, "execution_time_ms"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
