package taskforge.coordinator.store;

import taskforge.coordinator.broker.ActiveJob;
import taskforge.coordinator.broker.BrokerState;
import taskforge.coordinator.broker.EnqueueResult;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.QueueStats;
import taskforge.coordinator.broker.RetentionPolicy;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.coordinator.broker.RetryPolicy;
import taskforge.exception.BrokerUnavailableException;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.DispatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static taskforge.coordinator.store.JdbcTaskStore.setTimestamp;
import static taskforge.coordinator.store.JdbcTaskStore.toInstant;

/**
 * JDBC implementation of JobBroker backed by the {@code dispatch_jobs} table.
 * <p>
 * Writers inside one broker instance are serialized by a lock, and every state
 * move is a conditional update on the previous state, so a record is never
 * handed to two callers.
 */
public class JdbcJobBroker implements JobBroker {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobBroker.class);

    private final Database db;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final RetentionPolicy retentionPolicy;
    private final Duration leaseGrace;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcJobBroker(Database db, Clock clock, RetryPolicy retryPolicy,
            RetentionPolicy retentionPolicy, Duration leaseGrace) {
        this.db = db;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.retentionPolicy = retentionPolicy;
        this.leaseGrace = leaseGrace;
    }

    @Override
    public EnqueueResult enqueue(DispatchMessage message) {
        String insertSql = """
                    INSERT INTO dispatch_jobs (task_id, prompt, code, timeout_seconds, state,
                                               attempts, max_attempts, available_at, enqueued_at)
                    VALUES (?, ?, ?, ?, 'WAITING', 0, ?, ?, ?)
                """;

        writeLock.lock();
        try (Connection conn = db.getConnection()) {
            try {
                Optional<BrokerState> existing = stateOf(conn, message.taskId(), true);
                if (existing.isPresent() && existing.get().isLive()) {
                    conn.rollback();
                    log.debug("Dispatch for task {} already {}, skipping", message.taskId(), existing.get());
                    return EnqueueResult.DUPLICATE;
                }
                if (existing.isPresent()) {
                    // Finished record kept for retention; a new dispatch replaces it
                    try (PreparedStatement ps = conn.prepareStatement("DELETE FROM dispatch_jobs WHERE task_id = ?")) {
                        ps.setString(1, message.taskId());
                        ps.executeUpdate();
                    }
                }

                Instant now = clock.instant();
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, message.taskId());
                    ps.setString(2, message.prompt());
                    ps.setString(3, message.code());
                    ps.setInt(4, message.timeout());
                    ps.setInt(5, retryPolicy.maxAttempts());
                    setTimestamp(ps, 6, now);
                    setTimestamp(ps, 7, now);
                    ps.executeUpdate();
                }

                conn.commit();
                log.debug("Enqueued dispatch for task {}", message.taskId());
                return EnqueueResult.ENQUEUED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to enqueue task " + message.taskId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<ClaimedJob> claim(String workerId) {
        String selectSql = """
                    SELECT task_id, prompt, code, timeout_seconds, state, attempts, max_attempts
                    FROM dispatch_jobs
                    WHERE state = 'WAITING' OR (state = 'DELAYED' AND available_at <= ?)
                    ORDER BY available_at, enqueued_at
                    LIMIT 1
                    FOR UPDATE
                """;

        String updateSql = """
                    UPDATE dispatch_jobs
                    SET state = 'ACTIVE', worker_id = ?, attempts = attempts + 1, lease_deadline = ?
                    WHERE task_id = ? AND state = ?
                """;

        writeLock.lock();
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                Instant now = clock.instant();
                setTimestamp(selectPs, 1, now);

                ClaimedJob job;
                String previousState;
                try (ResultSet rs = selectPs.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        return Optional.empty();
                    }
                    DispatchMessage message = new DispatchMessage(
                            rs.getString("task_id"),
                            rs.getString("prompt"),
                            rs.getString("code"),
                            rs.getInt("timeout_seconds"));
                    job = ClaimedJob.of(message, rs.getInt("attempts") + 1, rs.getInt("max_attempts"));
                    previousState = rs.getString("state");
                }

                updatePs.setString(1, workerId);
                setTimestamp(updatePs, 2, now.plusSeconds(job.timeout()).plus(leaseGrace));
                updatePs.setString(3, job.taskId());
                updatePs.setString(4, previousState);

                if (updatePs.executeUpdate() == 0) {
                    conn.rollback();
                    return Optional.empty();
                }

                conn.commit();
                log.debug("Worker {} claimed task {} (attempt {}/{})",
                        workerId, job.taskId(), job.attempt(), job.maxAttempts());
                return Optional.of(job);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to claim a job for worker " + workerId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean ack(String taskId, String workerId) {
        String sql = """
                    UPDATE dispatch_jobs
                    SET state = 'COMPLETED', finished_at = ?, lease_deadline = NULL
                    WHERE task_id = ? AND state = 'ACTIVE' AND worker_id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, clock.instant());
                ps.setString(2, taskId);
                ps.setString(3, workerId);

                int updated = ps.executeUpdate();
                conn.commit();

                if (updated == 0) {
                    log.warn("Ack ignored: task {} is not active for worker {}", taskId, workerId);
                    return false;
                }
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to ack task " + taskId, e);
        }
    }

    @Override
    public RetryDecision retry(String taskId, String workerId, String error) {
        String selectSql = """
                    SELECT state, worker_id, attempts, max_attempts
                    FROM dispatch_jobs
                    WHERE task_id = ?
                    FOR UPDATE
                """;

        String delaySql = """
                    UPDATE dispatch_jobs
                    SET state = 'DELAYED', available_at = ?, worker_id = NULL, lease_deadline = NULL, last_error = ?
                    WHERE task_id = ? AND state = 'ACTIVE'
                """;

        String failSql = """
                    UPDATE dispatch_jobs
                    SET state = 'FAILED', finished_at = ?, lease_deadline = NULL, last_error = ?
                    WHERE task_id = ? AND state = 'ACTIVE'
                """;

        writeLock.lock();
        try (Connection conn = db.getConnection()) {
            try {
                int attempts;
                int maxAttempts;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, taskId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()
                                || !BrokerState.ACTIVE.name().equals(rs.getString("state"))
                                || !workerId.equals(rs.getString("worker_id"))) {
                            conn.rollback();
                            log.warn("Retry ignored: task {} is not active for worker {}", taskId, workerId);
                            return RetryDecision.notActive();
                        }
                        attempts = rs.getInt("attempts");
                        maxAttempts = rs.getInt("max_attempts");
                    }
                }

                Instant now = clock.instant();
                RetryDecision decision;
                if (attempts < maxAttempts) {
                    Duration delay = retryPolicy.computeBackoff(attempts);
                    try (PreparedStatement ps = conn.prepareStatement(delaySql)) {
                        setTimestamp(ps, 1, now.plus(delay));
                        ps.setString(2, error);
                        ps.setString(3, taskId);
                        ps.executeUpdate();
                    }
                    decision = RetryDecision.scheduled(delay, attempts);
                    log.info("Task {} failed attempt {}/{}, retrying in {} ms",
                            taskId, attempts, maxAttempts, delay.toMillis());
                } else {
                    try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                        setTimestamp(ps, 1, now);
                        ps.setString(2, error);
                        ps.setString(3, taskId);
                        ps.executeUpdate();
                    }
                    decision = RetryDecision.deadLettered(attempts);
                    log.warn("Task {} exhausted {} attempts, moved to failed: {}", taskId, attempts, error);
                }

                conn.commit();
                return decision;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to retry task " + taskId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<BrokerState> stateOf(String taskId) {
        try (Connection conn = db.getConnection()) {
            return stateOf(conn, taskId, false);
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to look up dispatch for task " + taskId, e);
        }
    }

    @Override
    public Optional<String> lastError(String taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT last_error FROM dispatch_jobs WHERE task_id = ?")) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("last_error"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to read last error for task " + taskId, e);
        }
    }

    @Override
    public List<ActiveJob> findExpiredLeases(Instant now) {
        String sql = """
                    SELECT task_id, worker_id, attempts, lease_deadline
                    FROM dispatch_jobs
                    WHERE state = 'ACTIVE' AND lease_deadline < ?
                    ORDER BY lease_deadline
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);

            List<ActiveJob> expired = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    expired.add(new ActiveJob(
                            rs.getString("task_id"),
                            rs.getString("worker_id"),
                            rs.getInt("attempts"),
                            toInstant(rs.getTimestamp("lease_deadline"))));
                }
            }
            return expired;
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to find expired leases", e);
        }
    }

    @Override
    public int purgeFinished() {
        String byAgeSql = "DELETE FROM dispatch_jobs WHERE state = ? AND finished_at < ?";

        String byCountSql = """
                    DELETE FROM dispatch_jobs
                    WHERE state = 'COMPLETED'
                      AND task_id NOT IN (
                          SELECT task_id FROM dispatch_jobs
                          WHERE state = 'COMPLETED'
                          ORDER BY finished_at DESC
                          LIMIT ?
                      )
                """;

        Instant now = clock.instant();
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ageStmt = conn.prepareStatement(byAgeSql);
                    PreparedStatement countStmt = conn.prepareStatement(byCountSql)) {

                ageStmt.setString(1, BrokerState.COMPLETED.name());
                setTimestamp(ageStmt, 2, now.minus(retentionPolicy.completedMaxAge()));
                int removed = ageStmt.executeUpdate();

                ageStmt.setString(1, BrokerState.FAILED.name());
                setTimestamp(ageStmt, 2, now.minus(retentionPolicy.failedMaxAge()));
                removed += ageStmt.executeUpdate();

                countStmt.setInt(1, retentionPolicy.completedMaxCount());
                removed += countStmt.executeUpdate();

                conn.commit();

                if (removed > 0) {
                    log.debug("Purged {} finished dispatch records", removed);
                }
                return removed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to purge finished dispatch records", e);
        }
    }

    @Override
    public QueueStats stats() {
        String sql = "SELECT state, COUNT(*) AS cnt FROM dispatch_jobs GROUP BY state";

        Map<BrokerState, Integer> counts = new EnumMap<>(BrokerState.class);
        for (BrokerState state : BrokerState.values()) {
            counts.put(state, 0);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(BrokerState.valueOf(rs.getString("state")), rs.getInt("cnt"));
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to read queue stats", e);
        }

        return new QueueStats(
                counts.get(BrokerState.WAITING),
                counts.get(BrokerState.ACTIVE),
                counts.get(BrokerState.COMPLETED),
                counts.get(BrokerState.FAILED),
                counts.get(BrokerState.DELAYED));
    }

    // Helper methods

    private Optional<BrokerState> stateOf(Connection conn, String taskId, boolean forUpdate) throws SQLException {
        String sql = "SELECT state FROM dispatch_jobs WHERE task_id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(BrokerState.valueOf(rs.getString("state")));
                }
            }
            return Optional.empty();
        }
    }
}
