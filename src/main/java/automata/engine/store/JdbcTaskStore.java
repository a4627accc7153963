package automata.engine.store;

import automata.engine.config.EngineConfig;
import automata.engine.exception.StoreException;
import automata.engine.model.ExecutionStatus;
import automata.engine.model.RetryPolicy;
import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskCounts;
import automata.engine.model.TaskExecution;
import automata.engine.model.TaskStatus;
import automata.engine.model.TaskType;
import automata.engine.model.action.TaskAction;
import automata.engine.repository.TaskStore;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of TaskStore.
 * Due tasks are claimed with a compare-and-set lease (claimed_by, claimed_until),
 * optionally combined with FOR UPDATE SKIP LOCKED.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private final Database db;
    private final Clock clock;
    private final String workerId;
    private final Duration claimTimeout;
    private final boolean skipLocked;

    public JdbcTaskStore(Database db, EngineConfig config) {
        this(db, config, Clock.systemUTC());
    }

    public JdbcTaskStore(Database db, EngineConfig config, Clock clock) {
        this.db = db;
        this.clock = clock;
        this.workerId = config.workerId();
        this.claimTimeout = config.claimTimeout();
        this.skipLocked = config.skipLocked();
    }

    @Override
    public void save(ScheduledTask task) {
        String sql = """
                    INSERT INTO scheduled_tasks (id, user_id, name, description, type, schedule, trigger_config,
                                                 action, conditions, retry_policy, notification_config, status,
                                                 last_run_at, next_run_at, run_count, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.userId());
            ps.setString(3, task.name());
            ps.setString(4, task.description());
            ps.setString(5, task.type().value());
            ps.setString(6, Json.write(task.schedule()));
            ps.setString(7, Json.write(task.trigger()));
            ps.setString(8, Json.write(task.action()));
            ps.setString(9, Json.write(task.conditions()));
            ps.setString(10, Json.write(task.retryPolicy()));
            ps.setString(11, Json.write(task.notification()));
            ps.setString(12, task.status().value());
            setTimestamp(ps, 13, task.lastRun());
            setTimestamp(ps, 14, task.nextRun());
            ps.setInt(15, task.runCount());
            setTimestamp(ps, 16, task.createdAt() != null ? task.createdAt() : now);
            setTimestamp(ps, 17, task.updatedAt() != null ? task.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<ScheduledTask> findById(String taskId) {
        String sql = "SELECT * FROM scheduled_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapTask(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<ScheduledTask> findByUser(String userId, TaskStatus status, int limit) {
        String sql = status == null
                ? "SELECT * FROM scheduled_tasks WHERE user_id = ? ORDER BY created_at DESC LIMIT ?"
                : "SELECT * FROM scheduled_tasks WHERE user_id = ? AND status = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, userId);
            if (status != null) {
                ps.setString(i++, status.value());
            }
            ps.setInt(i, limit);
            return queryTasks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks for user: " + userId, e);
        }
    }

    @Override
    public List<ScheduledTask> findUpcoming(String userId, int limit) {
        String sql = """
                    SELECT * FROM scheduled_tasks
                    WHERE user_id = ? AND status = 'active' AND next_run_at IS NOT NULL
                    ORDER BY next_run_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, userId);
            ps.setInt(2, limit);
            return queryTasks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find upcoming tasks for user: " + userId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status) {
        String sql = "UPDATE scheduled_tasks SET status = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.value());
            setTimestamp(ps, 2, clock.instant());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update status of task: " + taskId, e);
        }
    }

    @Override
    public boolean updateNextRun(String taskId, Instant nextRun) {
        String sql = "UPDATE scheduled_tasks SET next_run_at = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, nextRun);
            setTimestamp(ps, 2, clock.instant());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update next run of task: " + taskId, e);
        }
    }

    @Override
    public List<ScheduledTask> selectDueTasks(int limit) {
        String selectSql = """
                    SELECT * FROM scheduled_tasks
                    WHERE status = 'active'
                      AND type IN ('one-time', 'recurring')
                      AND next_run_at IS NOT NULL
                      AND next_run_at <= ?
                      AND (claimed_until IS NULL OR claimed_until < ?)
                    ORDER BY next_run_at
                    LIMIT ?
                """ + (skipLocked ? " FOR UPDATE SKIP LOCKED" : "");

        String claimSql = """
                    UPDATE scheduled_tasks
                    SET claimed_by = ?, claimed_until = ?
                    WHERE id = ? AND status = 'active'
                      AND (claimed_until IS NULL OR claimed_until < ?)
                """;

        String failUnreadableSql = """
                    UPDATE scheduled_tasks
                    SET status = 'failed', claimed_by = NULL, claimed_until = NULL, updated_at = ?
                    WHERE id = ? AND status = 'active'
                      AND (claimed_until IS NULL OR claimed_until < ?)
                """;

        Instant now = clock.instant();
        Instant leaseEnd = now.plus(claimTimeout);
        List<ScheduledTask> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement claimPs = conn.prepareStatement(claimSql);
                    PreparedStatement failPs = conn.prepareStatement(failUnreadableSql)) {

                setTimestamp(selectPs, 1, now);
                setTimestamp(selectPs, 2, now);
                selectPs.setInt(3, limit);

                List<ScheduledTask> candidates = new ArrayList<>();
                List<String> unreadable = new ArrayList<>();
                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        String id = rs.getString("id");
                        try {
                            candidates.add(mapTask(rs));
                        } catch (RuntimeException e) {
                            log.error("Task {} has an unreadable definition and will be marked failed: {}",
                                    id, e.getMessage());
                            unreadable.add(id);
                        }
                    }
                }

                for (String id : unreadable) {
                    setTimestamp(failPs, 1, now);
                    failPs.setString(2, id);
                    setTimestamp(failPs, 3, now);
                    failPs.executeUpdate();
                }

                for (ScheduledTask candidate : candidates) {
                    claimPs.setString(1, workerId);
                    setTimestamp(claimPs, 2, leaseEnd);
                    claimPs.setString(3, candidate.id());
                    setTimestamp(claimPs, 4, now);

                    // zero rows: another caller claimed it between our select and update
                    if (claimPs.executeUpdate() == 1) {
                        claimed.add(candidate);
                    }
                }

                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to select due tasks for worker: " + workerId, e);
        }

        if (!claimed.isEmpty()) {
            log.debug("Worker {} claimed {} due task(s)", workerId, claimed.size());
        }
        return claimed;
    }

    @Override
    public boolean markFailed(String taskId) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'failed', claimed_by = NULL, claimed_until = NULL, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant());
            ps.setString(2, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task failed: " + taskId, e);
        }
    }

    @Override
    public boolean rescheduleAt(String taskId, Instant instant) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET next_run_at = ?, claimed_by = NULL, claimed_until = NULL, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, instant);
            setTimestamp(ps, 2, clock.instant());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to reschedule task: " + taskId, e);
        }
    }

    @Override
    public String startExecution(String taskId, Instant startedAt, List<String> logs) {
        String sql = """
                    INSERT INTO task_executions (id, task_id, status, started_at, logs)
                    VALUES (?, ?, ?, ?, ?)
                """;

        String executionId = UUID.randomUUID().toString();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, taskId);
            ps.setString(3, ExecutionStatus.RUNNING.value());
            setTimestamp(ps, 4, startedAt);
            ps.setString(5, Json.write(logs));

            ps.executeUpdate();
            conn.commit();
            return executionId;
        } catch (SQLException e) {
            throw new StoreException("Failed to start execution of task: " + taskId, e);
        }
    }

    @Override
    public void recordSuccess(ScheduledTask task, String executionId, JsonNode result, List<String> logs,
            Instant completedAt, Instant nextRun) {
        String taskSql = """
                    UPDATE scheduled_tasks
                    SET last_run_at = ?, next_run_at = ?, run_count = run_count + 1,
                        status = CASE WHEN type = 'one-time' THEN 'completed' ELSE status END,
                        claimed_by = NULL, claimed_until = NULL, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                completeExecution(conn, executionId, ExecutionStatus.COMPLETED, Json.write(result), null, logs,
                        completedAt);

                try (PreparedStatement ps = conn.prepareStatement(taskSql)) {
                    setTimestamp(ps, 1, completedAt);
                    setTimestamp(ps, 2, nextRun);
                    setTimestamp(ps, 3, completedAt);
                    ps.setString(4, task.id());
                    ps.executeUpdate();
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record success of task: " + task.id(), e);
        }
    }

    @Override
    public void recordFailure(ScheduledTask task, String executionId, String error, List<String> logs,
            Instant completedAt) {
        String taskSql = """
                    UPDATE scheduled_tasks
                    SET last_run_at = ?, run_count = run_count + 1, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                completeExecution(conn, executionId, ExecutionStatus.FAILED, null, error, logs, completedAt);

                try (PreparedStatement ps = conn.prepareStatement(taskSql)) {
                    setTimestamp(ps, 1, completedAt);
                    setTimestamp(ps, 2, completedAt);
                    ps.setString(3, task.id());
                    ps.executeUpdate();
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record failure of task: " + task.id(), e);
        }
    }

    @Override
    public void recordSkipped(ScheduledTask task, String executionId, List<String> logs, Instant completedAt,
            Instant nextRun) {
        String taskSql = """
                    UPDATE scheduled_tasks
                    SET next_run_at = ?, claimed_by = NULL, claimed_until = NULL, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                completeExecution(conn, executionId, ExecutionStatus.COMPLETED, null, null, logs, completedAt);

                try (PreparedStatement ps = conn.prepareStatement(taskSql)) {
                    setTimestamp(ps, 1, nextRun);
                    setTimestamp(ps, 2, completedAt);
                    ps.setString(3, task.id());
                    ps.executeUpdate();
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record skipped run of task: " + task.id(), e);
        }
    }

    @Override
    public List<TaskExecution> findExecutions(String taskId, int limit) {
        String sql = "SELECT * FROM task_executions WHERE task_id = ? ORDER BY started_at DESC, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            ps.setInt(2, limit);

            List<TaskExecution> executions = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    executions.add(mapExecution(rs));
                }
            }
            return executions;
        } catch (SQLException e) {
            throw new StoreException("Failed to find executions of task: " + taskId, e);
        }
    }

    @Override
    public int pruneCompleted(int olderThanDays) {
        String sql = """
                    DELETE FROM scheduled_tasks
                    WHERE type = 'one-time' AND status = 'completed' AND updated_at < ?
                """;

        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Pruned {} completed one-time task(s) older than {} days", deleted, olderThanDays);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to prune completed tasks", e);
        }
    }

    @Override
    public int pruneExecutionHistory(int keepPerTask) {
        String sql = """
                    DELETE FROM task_executions
                    WHERE id IN (
                        SELECT id FROM (
                            SELECT id, ROW_NUMBER() OVER (PARTITION BY task_id ORDER BY started_at DESC, id) AS rn
                            FROM task_executions
                        ) ranked
                        WHERE rn > ?
                    )
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, keepPerTask);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Pruned {} execution record(s) beyond {} per task", deleted, keepPerTask);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to prune execution history", e);
        }
    }

    @Override
    public TaskCounts getCounts(Duration dueWithin) {
        String sql = """
                    SELECT
                        COALESCE(SUM(CASE WHEN status = 'active' THEN 1 ELSE 0 END), 0) AS active_count,
                        COALESCE(SUM(CASE WHEN status = 'paused' THEN 1 ELSE 0 END), 0) AS paused_count,
                        COALESCE(SUM(CASE WHEN status = 'completed' THEN 1 ELSE 0 END), 0) AS completed_count,
                        COALESCE(SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END), 0) AS failed_count,
                        COALESCE(SUM(CASE WHEN status = 'active' AND next_run_at IS NOT NULL
                                           AND next_run_at <= ? THEN 1 ELSE 0 END), 0) AS due_soon_count
                    FROM scheduled_tasks
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant().plus(dueWithin));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new TaskCounts(
                        rs.getLong("active_count"),
                        rs.getLong("paused_count"),
                        rs.getLong("completed_count"),
                        rs.getLong("failed_count"),
                        rs.getLong("due_soon_count"));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    // ---------- helpers ----------

    private void completeExecution(Connection conn, String executionId, ExecutionStatus status, String result,
            String error, List<String> logs, Instant completedAt) throws SQLException {
        Instant startedAt = null;
        try (PreparedStatement ps = conn.prepareStatement("SELECT started_at FROM task_executions WHERE id = ?")) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    startedAt = toInstant(rs.getTimestamp("started_at"));
                }
            }
        }
        if (startedAt == null) {
            throw new SQLException("Execution not found: " + executionId);
        }

        String sql = """
                    UPDATE task_executions
                    SET status = ?, completed_at = ?, duration_ms = ?, result = ?, error = ?, logs = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.value());
            setTimestamp(ps, 2, completedAt);
            ps.setLong(3, Math.max(0, Duration.between(startedAt, completedAt).toMillis()));
            ps.setString(4, result);
            ps.setString(5, error);
            ps.setString(6, Json.write(logs));
            ps.setString(7, executionId);
            ps.executeUpdate();
        }
    }

    private List<ScheduledTask> queryTasks(PreparedStatement ps) throws SQLException {
        List<ScheduledTask> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapTask(rs));
            }
        }
        return tasks;
    }

    private ScheduledTask mapTask(ResultSet rs) throws SQLException {
        return ScheduledTask.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .type(TaskType.fromValue(rs.getString("type")))
                .schedule(Json.parse(rs.getString("schedule")))
                .trigger(Json.parse(rs.getString("trigger_config")))
                .action(Json.read(rs.getString("action"), TaskAction.class))
                .conditions(Json.parse(rs.getString("conditions")))
                .retryPolicy(Json.read(rs.getString("retry_policy"), RetryPolicy.class))
                .notification(Json.parse(rs.getString("notification_config")))
                .status(TaskStatus.fromValue(rs.getString("status")))
                .lastRun(toInstant(rs.getTimestamp("last_run_at")))
                .nextRun(toInstant(rs.getTimestamp("next_run_at")))
                .runCount(rs.getInt("run_count"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private TaskExecution mapExecution(ResultSet rs) throws SQLException {
        return new TaskExecution(
                rs.getString("id"),
                rs.getString("task_id"),
                ExecutionStatus.fromValue(rs.getString("status")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                getLongOrNull(rs, "duration_ms"),
                Json.parse(rs.getString("result")),
                rs.getString("error"),
                readLogs(rs.getString("logs")));
    }

    private static List<String> readLogs(String text) {
        JsonNode node = Json.parse(text);
        List<String> logs = new ArrayList<>();
        if (node != null) {
            node.forEach(line -> logs.add(line.asText()));
        }
        return logs;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
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
