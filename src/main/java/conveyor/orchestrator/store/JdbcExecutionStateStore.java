package conveyor.orchestrator.store;

import com.fasterxml.jackson.core.type.TypeReference;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.PipelineSpec;
import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.repository.StateStoreException;
import conveyor.orchestrator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of ExecutionStateStore.
 * Each transition is a single-row conditional UPDATE ({@code WHERE ... AND status = ?});
 * the affected row count tells the caller whether it won the race.
 */
public class JdbcExecutionStateStore implements ExecutionStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStateStore.class);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, ResolvedInput>> INPUT_MAP = new TypeReference<>() {
    };

    private final Database db;

    public JdbcExecutionStateStore(Database db) {
        this.db = db;
    }

    @Override
    public void createRun(PipelineRun run, List<String> taskIds) {
        String runSql = """
                    INSERT INTO runs (id, pipeline_name, pipeline, arguments, annotations, status,
                                      cancel_requested, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String taskSql = """
                    INSERT INTO task_executions (run_id, task_id, seq_no, status, retry_count, infra_retry_count, created_at)
                    VALUES (?, ?, ?, 'PENDING', 0, 0, ?)
                """;

        Instant createdAt = run.createdAt() != null ? run.createdAt() : Instant.now();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement runPs = conn.prepareStatement(runSql);
                    PreparedStatement taskPs = conn.prepareStatement(taskSql)) {

                runPs.setString(1, run.id());
                runPs.setString(2, run.pipeline().name());
                runPs.setString(3, Json.write(run.pipeline()));
                runPs.setString(4, Json.write(run.arguments()));
                runPs.setString(5, Json.write(run.annotations()));
                runPs.setString(6, run.status().name());
                runPs.setBoolean(7, run.cancelRequested());
                setTimestamp(runPs, 8, createdAt);
                runPs.executeUpdate();

                int seq = 0;
                for (String taskId : taskIds) {
                    taskPs.setString(1, run.id());
                    taskPs.setString(2, taskId);
                    taskPs.setInt(3, seq++);
                    setTimestamp(taskPs, 4, createdAt);
                    taskPs.addBatch();
                }
                if (!taskIds.isEmpty()) {
                    taskPs.executeBatch();
                }

                conn.commit();
                log.debug("Created run {} with {} task executions", run.id(), taskIds.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to create run: " + run.id(), e);
        }
    }

    @Override
    public Optional<PipelineRun> findRun(String runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRun(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public Optional<RunState> getRunState(String runId) {
        String runSql = "SELECT * FROM runs WHERE id = ?";
        String taskSql = "SELECT * FROM task_executions WHERE run_id = ? ORDER BY seq_no";
        String outputSql = "SELECT task_id, output_name, artifact_uri FROM task_outputs WHERE run_id = ? ORDER BY task_id, output_name";

        try (Connection conn = db.getConnection()) {
            PipelineRun run;
            try (PreparedStatement ps = conn.prepareStatement(runSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    run = mapRun(rs);
                }
            }

            Map<String, Map<String, String>> outputs = new HashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(outputSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        outputs.computeIfAbsent(rs.getString("task_id"), k -> new LinkedHashMap<>())
                                .put(rs.getString("output_name"), rs.getString("artifact_uri"));
                    }
                }
            }

            Map<String, TaskExecution> tasks = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(taskSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        TaskExecution execution = mapTask(rs, outputs);
                        tasks.put(execution.taskId(), execution);
                    }
                }
            }

            conn.commit();
            return Optional.of(new RunState(run, tasks));
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read state of run: " + runId, e);
        }
    }

    @Override
    public List<PipelineRun> listRuns(int limit) {
        String sql = "SELECT * FROM runs ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<PipelineRun> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRun(rs));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list runs", e);
        }
    }

    @Override
    public List<String> findActiveRunIds() {
        String sql = "SELECT id FROM runs WHERE status IN ('PENDING', 'RUNNING') ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<String> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(rs.getString("id"));
            }
            return ids;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to find active runs", e);
        }
    }

    @Override
    public boolean transitionRun(String runId, RunStatus expected, RunStatus next, String errorMessage) {
        String sql = """
                    UPDATE runs
                    SET status = ?,
                        started_at = CASE WHEN ? THEN COALESCE(started_at, ?) ELSE started_at END,
                        finished_at = CASE WHEN ? THEN ? ELSE finished_at END,
                        error_message = COALESCE(?, error_message)
                    WHERE id = ? AND status = ?
                """;

        Timestamp now = Timestamp.from(Instant.now());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setBoolean(2, next == RunStatus.RUNNING);
            ps.setTimestamp(3, now);
            ps.setBoolean(4, next.isTerminal());
            ps.setTimestamp(5, now);
            ps.setString(6, truncate(errorMessage));
            ps.setString(7, runId);
            ps.setString(8, expected.name());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Run {} {} -> {}", runId, expected, next);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to transition run: " + runId, e);
        }
    }

    @Override
    public boolean requestCancellation(String runId) {
        String sql = "UPDATE runs SET cancel_requested = TRUE WHERE id = ? AND status IN ('PENDING', 'RUNNING')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to request cancellation of run: " + runId, e);
        }
    }

    @Override
    public boolean transitionTask(TaskExecution expected, TaskExecution updated) {
        String selectSql = "SELECT * FROM task_executions WHERE run_id = ? AND task_id = ?";
        String updateSql = """
                    UPDATE task_executions
                    SET status = ?, resolved_inputs = ?, execution_id = ?, handle = ?, retry_count = ?,
                        infra_retry_count = ?, not_before = ?, error_message = ?, started_at = ?, finished_at = ?
                    WHERE run_id = ? AND task_id = ? AND status = ? AND execution_id IS NOT DISTINCT FROM ?
                        AND retry_count = ? AND infra_retry_count = ?
                """;

        String runId = updated.runId();
        String taskId = updated.taskId();

        try (Connection conn = db.getConnection()) {
            try {
                TaskExecution previous = null;
                boolean endsAttempt = expected.status().isInFlight() && !updated.status().isInFlight();
                if (endsAttempt) {
                    try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                        ps.setString(1, runId);
                        ps.setString(2, taskId);
                        try (ResultSet rs = ps.executeQuery()) {
                            if (!rs.next()) {
                                conn.rollback();
                                return false;
                            }
                            previous = mapTask(rs, Map.of());
                        }
                    }
                }

                int changed;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, updated.status().name());
                    ps.setString(2, updated.resolvedInputs().isEmpty() ? null : Json.write(updated.resolvedInputs(), INPUT_MAP));
                    ps.setString(3, updated.executionId());
                    ps.setString(4, updated.handle());
                    ps.setInt(5, updated.retryCount());
                    ps.setInt(6, updated.infraRetryCount());
                    setTimestamp(ps, 7, updated.notBefore());
                    ps.setString(8, truncate(updated.errorMessage()));
                    setTimestamp(ps, 9, updated.startedAt());
                    setTimestamp(ps, 10, updated.finishedAt());
                    ps.setString(11, runId);
                    ps.setString(12, taskId);
                    ps.setString(13, expected.status().name());
                    ps.setString(14, expected.executionId());
                    ps.setInt(15, expected.retryCount());
                    ps.setInt(16, expected.infraRetryCount());
                    changed = ps.executeUpdate();
                }

                if (changed == 0) {
                    conn.rollback();
                    return false;
                }

                if (endsAttempt && previous != null && previous.status() == expected.status()) {
                    archiveAttempt(conn, previous, updated);
                    if (updated.status() == TaskStatus.PENDING) {
                        clearOutputs(conn, runId, taskId);
                    }
                }

                conn.commit();
                log.debug("Task {}/{} {} -> {}", runId, taskId, expected.status(), updated.status());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to transition task: " + runId + "/" + taskId, e);
        }
    }

    private void archiveAttempt(Connection conn, TaskExecution previous, TaskExecution updated) throws SQLException {
        String sql = """
                    INSERT INTO task_attempts (run_id, task_id, attempt, execution_id, handle, status,
                                               error_message, started_at, finished_at)
                    SELECT ?, ?, COALESCE(MAX(attempt), 0) + 1, ?, ?, ?, ?, ?, ?
                    FROM task_attempts WHERE run_id = ? AND task_id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, previous.runId());
            ps.setString(2, previous.taskId());
            ps.setString(3, previous.executionId());
            ps.setString(4, previous.handle());
            ps.setString(5, attemptStatus(updated.status()).name());
            ps.setString(6, truncate(updated.errorMessage()));
            setTimestamp(ps, 7, previous.startedAt());
            setTimestamp(ps, 8, updated.finishedAt() != null ? updated.finishedAt() : Instant.now());
            ps.setString(9, previous.runId());
            ps.setString(10, previous.taskId());
            ps.executeUpdate();
        }
    }

    private void clearOutputs(Connection conn, String runId, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM task_outputs WHERE run_id = ? AND task_id = ?")) {
            ps.setString(1, runId);
            ps.setString(2, taskId);
            ps.executeUpdate();
        }
    }

    /** A retry (back to PENDING) archives the attempt as FAILED. */
    static TaskStatus attemptStatus(TaskStatus next) {
        return next == TaskStatus.PENDING ? TaskStatus.FAILED : next;
    }

    @Override
    public void recordTaskOutput(String runId, String taskId, String outputName, String artifactUri) {
        String updateSql = "UPDATE task_outputs SET artifact_uri = ? WHERE run_id = ? AND task_id = ? AND output_name = ?";
        String insertSql = "INSERT INTO task_outputs (run_id, task_id, output_name, artifact_uri) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, artifactUri);
                    ps.setString(2, runId);
                    ps.setString(3, taskId);
                    ps.setString(4, outputName);
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, runId);
                        ps.setString(2, taskId);
                        ps.setString(3, outputName);
                        ps.setString(4, artifactUri);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to record output " + outputName + " of task: " + runId + "/" + taskId, e);
        }
    }

    @Override
    public List<TaskExecution> listReadyCandidates(String runId, Instant now) {
        String sql = """
                    SELECT * FROM task_executions
                    WHERE run_id = ? AND status = 'PENDING' AND (not_before IS NULL OR not_before <= ?)
                    ORDER BY seq_no
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            setTimestamp(ps, 2, now);
            return executeTaskQuery(ps);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list ready candidates of run: " + runId, e);
        }
    }

    @Override
    public int countInFlight() {
        String sql = "SELECT COUNT(*) FROM task_executions WHERE status IN ('STARTING', 'RUNNING')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to count in-flight tasks", e);
        }
    }

    @Override
    public List<TaskExecution> findStaleStarting(Instant startedBefore) {
        String sql = """
                    SELECT t.* FROM task_executions t
                    JOIN runs r ON r.id = t.run_id
                    WHERE t.status = 'STARTING' AND t.started_at < ? AND r.status IN ('PENDING', 'RUNNING')
                    ORDER BY t.started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedBefore);
            return executeTaskQuery(ps);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to find stale STARTING tasks", e);
        }
    }

    @Override
    public List<TaskAttempt> listAttempts(String runId, String taskId) {
        String sql = "SELECT * FROM task_attempts WHERE run_id = ? AND task_id = ? ORDER BY attempt";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, taskId);
            List<TaskAttempt> attempts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    attempts.add(new TaskAttempt(
                            rs.getString("run_id"),
                            rs.getString("task_id"),
                            rs.getInt("attempt"),
                            rs.getString("execution_id"),
                            rs.getString("handle"),
                            TaskStatus.valueOf(rs.getString("status")),
                            rs.getString("error_message"),
                            getInstant(rs, "started_at"),
                            getInstant(rs, "finished_at")));
                }
            }
            return attempts;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list attempts of task: " + runId + "/" + taskId, e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // ==================== Helpers ====================

    private List<TaskExecution> executeTaskQuery(PreparedStatement ps) throws SQLException {
        List<TaskExecution> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapTask(rs, Map.of()));
            }
        }
        return tasks;
    }

    private PipelineRun mapRun(ResultSet rs) throws SQLException {
        String arguments = rs.getString("arguments");
        String annotations = rs.getString("annotations");
        return PipelineRun.builder()
                .id(rs.getString("id"))
                .pipeline(Json.read(rs.getString("pipeline"), PipelineSpec.class))
                .arguments(arguments != null ? Json.read(arguments, STRING_MAP) : Map.of())
                .annotations(annotations != null ? Json.read(annotations, OBJECT_MAP) : Map.of())
                .status(RunStatus.valueOf(rs.getString("status")))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .build();
    }

    private TaskExecution mapTask(ResultSet rs, Map<String, Map<String, String>> outputs) throws SQLException {
        String runId = rs.getString("run_id");
        String taskId = rs.getString("task_id");
        String inputs = rs.getString("resolved_inputs");
        return TaskExecution.builder()
                .runId(runId)
                .taskId(taskId)
                .status(TaskStatus.valueOf(rs.getString("status")))
                .resolvedInputs(inputs != null ? Json.read(inputs, INPUT_MAP) : Map.of())
                .outputs(outputs.getOrDefault(taskId, Map.of()))
                .executionId(rs.getString("execution_id"))
                .handle(rs.getString("handle"))
                .retryCount(rs.getInt("retry_count"))
                .infraRetryCount(rs.getInt("infra_retry_count"))
                .notBefore(getInstant(rs, "not_before"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .build();
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2048) {
            return message;
        }
        return message.substring(0, 2045) + "...";
    }
}
