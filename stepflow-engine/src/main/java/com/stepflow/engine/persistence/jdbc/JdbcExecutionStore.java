package com.stepflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.LeaseLostException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogLevel;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.StepResult;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.statemachine.ExecutionStateMachine;
import com.stepflow.core.statemachine.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

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

import static com.stepflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.stepflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of ExecutionStore.
 *
 * Claims use {@code FOR UPDATE SKIP LOCKED} so concurrent workers never lease
 * the same row. Every write made on behalf of a worker carries
 * {@code lease_owner = ? AND lease_expires_at > now} in its WHERE clause: a
 * zombie worker whose lease expired and was re-granted updates zero rows and
 * gets a {@link LeaseLostException}.
 */
@Repository("jdbcExecutionStore")
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStore.class);

    private static final String TERMINAL = "('COMPLETED', 'FAILED', 'CANCELLED')";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final JsonColumns json;
    private final ExecutionRowMapper rowMapper;
    private final RowMapper<ExecutionLogEntry> logRowMapper = new LogRowMapper();
    private final RowMapper<ExecutionCheckpoint> checkpointRowMapper;

    public JdbcExecutionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new ExecutionRowMapper(json);
        this.checkpointRowMapper = (rs, rowNum) -> new ExecutionCheckpoint(
            rs.getString("execution_id"),
            rs.getLong("sequence"),
            rs.getString("node_id"),
            rs.getString("next_node_id"),
            json.fromJson(rs.getString("state_json")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    @Override
    public Execution createExecution(WorkflowDefinition definition, JsonNode triggerPayload) {
        return createExecution(Execution.create(definition, triggerPayload, clock.instant()));
    }

    @Override
    @Transactional
    public Execution createExecution(Execution execution, List<ExecutionLogEntry> creationLogs) {
        String sql = """
            INSERT INTO workflow_executions (
                execution_id, workflow_id, workflow_version, status, current_node_id,
                state_json, step_count, retry_count, next_retry_at,
                lease_owner, lease_expires_at, awaiting_signal_type, cancel_requested,
                trigger_json, replay_of, replay_from_node_id,
                created_at, started_at, completed_at, error, error_node_id
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (execution_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            execution.executionId(),
            execution.workflowId(),
            execution.workflowVersion(),
            execution.status().name(),
            execution.currentNodeId(),
            json.toJson(execution.stateBlob()),
            execution.stepCount(),
            execution.retryCount(),
            toTimestamp(execution.nextRetryAt()),
            execution.leaseOwner(),
            toTimestamp(execution.leaseExpiresAt()),
            execution.awaitingSignalType(),
            execution.cancelRequested(),
            json.toJson(execution.triggerPayload()),
            execution.replayOf(),
            execution.replayFromNodeId(),
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.startedAt()),
            toTimestamp(execution.completedAt()),
            execution.error(),
            execution.errorNodeId()
        );

        if (rows == 0) {
            throw new IllegalArgumentException("Execution already exists: " + execution.executionId());
        }
        insertLogs(creationLogs);
        return execution;
    }

    @Override
    @Transactional
    public Optional<Execution> claim(String workerId, Duration leaseDuration) {
        Instant now = clock.instant();
        String sql = """
            UPDATE workflow_executions SET
                lease_owner = ?,
                lease_expires_at = ?
            WHERE execution_id = (
                SELECT e.execution_id FROM workflow_executions e
                WHERE e.status NOT IN %s
                  AND (e.lease_expires_at IS NULL OR e.lease_expires_at <= ?)
                  AND (
                       e.cancel_requested
                    OR e.status IN ('PENDING', 'RUNNING')
                    OR (e.status = 'PAUSED' AND e.next_retry_at IS NOT NULL AND e.next_retry_at <= ?)
                    OR (e.status = 'WAITING_SIGNAL' AND EXISTS (
                            SELECT 1 FROM workflow_signals s
                            WHERE s.execution_id = e.execution_id
                              AND s.signal_type = e.awaiting_signal_type
                              AND NOT s.processed))
                  )
                ORDER BY e.created_at
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """.formatted(TERMINAL);

        List<Execution> claimed = jdbcTemplate.query(sql, rowMapper,
            workerId,
            toTimestamp(now.plus(leaseDuration)),
            toTimestamp(now),
            toTimestamp(now)
        );

        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Worker {} claimed execution {}", workerId, claimed.get(0).executionId());
        return Optional.of(claimed.get(0));
    }

    @Override
    @Transactional
    public Execution renewLease(String executionId, String workerId, Duration leaseDuration) {
        Instant now = clock.instant();
        String sql = """
            UPDATE workflow_executions SET
                lease_expires_at = ?
            WHERE execution_id = ? AND lease_owner = ? AND lease_expires_at > ?
            RETURNING *
            """;

        List<Execution> renewed = jdbcTemplate.query(sql, rowMapper,
            toTimestamp(now.plus(leaseDuration)),
            executionId,
            workerId,
            toTimestamp(now)
        );

        if (renewed.isEmpty()) {
            log.warn("Failed to renew lease on {} for worker {} - lease expired or owner mismatch",
                executionId, workerId);
            throw new LeaseLostException(executionId, workerId);
        }
        return renewed.get(0);
    }

    @Override
    @Transactional
    public Execution persistStep(String executionId, String workerId, StepResult step) {
        Instant now = clock.instant();
        Execution next = step.execution();
        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                current_node_id = ?,
                state_json = ?::jsonb,
                step_count = ?,
                retry_count = ?,
                next_retry_at = ?,
                awaiting_signal_type = ?,
                cancel_requested = cancel_requested OR ?,
                started_at = ?,
                completed_at = ?,
                error = ?,
                error_node_id = ?
            WHERE execution_id = ?
              AND lease_owner = ?
              AND lease_expires_at > ?
              AND status NOT IN %s
            RETURNING *
            """.formatted(TERMINAL);

        List<Execution> updated = jdbcTemplate.query(sql, rowMapper,
            next.status().name(),
            next.currentNodeId(),
            json.toJson(next.stateBlob()),
            next.stepCount(),
            next.retryCount(),
            toTimestamp(next.nextRetryAt()),
            next.awaitingSignalType(),
            next.cancelRequested(),
            toTimestamp(next.startedAt()),
            toTimestamp(next.completedAt()),
            next.error(),
            next.errorNodeId(),
            executionId,
            workerId,
            toTimestamp(now)
        );

        if (updated.isEmpty()) {
            throw new LeaseLostException(executionId, workerId);
        }

        insertLogs(step.logEntries());
        if (step.checkpoint() != null) {
            insertCheckpoint(step.checkpoint());
        }
        return updated.get(0);
    }

    @Override
    @Transactional
    public void release(String executionId, String workerId) {
        String sql = """
            UPDATE workflow_executions SET
                lease_owner = NULL,
                lease_expires_at = NULL
            WHERE execution_id = ? AND lease_owner = ?
            """;

        int rows = jdbcTemplate.update(sql, executionId, workerId);
        if (rows > 0) {
            log.debug("Released lease on {} by worker {}", executionId, workerId);
        }
    }

    @Override
    @Transactional
    public Execution requestCancellation(String executionId, String reason) {
        Instant now = clock.instant();
        Execution stored = lockRow(executionId);
        if (stored.isTerminal()) {
            throw new InvalidStateTransitionException(executionId, stored.status(), "cancel");
        }

        if (stored.isLeased(now)) {
            jdbcTemplate.update(
                "UPDATE workflow_executions SET cancel_requested = TRUE WHERE execution_id = ?",
                executionId);
            insertLogs(List.of(ExecutionLogEntry.info(executionId, stored.currentNodeId(),
                "Cancellation requested" + (reason != null ? ": " + reason : ""), now)));
            return stored.toBuilder().cancelRequested(true).build();
        }

        Transition transition = ExecutionStateMachine.onCancel(stored, reason, now);
        Execution cancelled = transition.execution().toBuilder()
            .leaseOwner(null)
            .leaseExpiresAt(null)
            .build();
        overwrite(cancelled);
        insertLogs(transition.logEntries());
        return cancelled;
    }

    @Override
    @Transactional
    public Execution pause(String executionId) {
        Instant now = clock.instant();
        Execution stored = lockRow(executionId);
        if (stored.isTerminal() || stored.isLeased(now)) {
            throw new InvalidStateTransitionException(executionId, stored.status(), "pause");
        }
        Execution paused = ExecutionStateMachine.onPause(stored);
        overwrite(paused);
        insertLogs(List.of(ExecutionLogEntry.info(executionId, stored.currentNodeId(), "Execution paused", now)));
        return paused;
    }

    @Override
    @Transactional
    public Execution resume(String executionId) {
        Instant now = clock.instant();
        Execution stored = lockRow(executionId);
        if (stored.isLeased(now)) {
            throw new InvalidStateTransitionException(executionId, stored.status(), "resume");
        }
        Execution resumed = ExecutionStateMachine.onResume(stored, now);
        overwrite(resumed);
        insertLogs(List.of(ExecutionLogEntry.info(executionId, stored.currentNodeId(), "Execution resumed", now)));
        return resumed;
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        String sql = "SELECT * FROM workflow_executions WHERE execution_id = ?";
        List<Execution> results = jdbcTemplate.query(sql, rowMapper, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Execution> query(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM workflow_executions WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (query.workflowId() != null) {
            sql.append(" AND workflow_id = ?");
            params.add(query.workflowId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().name());
        }

        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());

        return jdbcTemplate.query(sql.toString(), rowMapper, params.toArray());
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        String sql = """
            SELECT status, COUNT(*) AS count
            FROM workflow_executions
            GROUP BY status
            """;

        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(ExecutionStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    @Override
    public long countActiveLeases(Instant now) {
        String sql = "SELECT COUNT(*) FROM workflow_executions WHERE lease_expires_at > ?";
        Long count = jdbcTemplate.queryForObject(sql, Long.class, toTimestamp(now));
        return count != null ? count : 0L;
    }

    @Override
    @Transactional
    public void appendLog(ExecutionLogEntry entry) {
        insertLogs(List.of(entry));
    }

    @Override
    public List<ExecutionLogEntry> findLogs(LogQuery query) {
        List<Object> params = new ArrayList<>();
        String where = logFilter(query, params);
        params.add(query.limit());
        params.add(query.offset());
        return jdbcTemplate.query(
            "SELECT * FROM execution_logs " + where + " ORDER BY id LIMIT ? OFFSET ?",
            logRowMapper, params.toArray());
    }

    @Override
    public long countLogs(LogQuery query) {
        List<Object> params = new ArrayList<>();
        String where = logFilter(query, params);
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM execution_logs " + where, Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    private String logFilter(LogQuery query, List<Object> params) {
        StringBuilder where = new StringBuilder("WHERE execution_id = ?");
        params.add(query.executionId());
        if (query.nodeId() != null) {
            where.append(" AND node_id = ?");
            params.add(query.nodeId());
        }
        if (query.level() != null) {
            where.append(" AND level = ?");
            params.add(query.level().name());
        }
        return where.toString();
    }

    @Override
    public List<ExecutionCheckpoint> findCheckpoints(String executionId) {
        String sql = "SELECT * FROM execution_checkpoints WHERE execution_id = ? ORDER BY sequence";
        return jdbcTemplate.query(sql, checkpointRowMapper, executionId);
    }

    @Override
    @Transactional
    public int deleteTerminalBefore(Instant cutoff) {
        // logs, checkpoints and signals go with the execution (ON DELETE CASCADE)
        String sql = """
            DELETE FROM workflow_executions
            WHERE status IN %s AND completed_at < ?
            """.formatted(TERMINAL);
        return jdbcTemplate.update(sql, toTimestamp(cutoff));
    }

    private Execution lockRow(String executionId) {
        List<Execution> rows = jdbcTemplate.query(
            "SELECT * FROM workflow_executions WHERE execution_id = ? FOR UPDATE", rowMapper, executionId);
        if (rows.isEmpty()) {
            throw new NotFoundException("Execution", executionId);
        }
        return rows.get(0);
    }

    private void overwrite(Execution execution) {
        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                current_node_id = ?,
                state_json = ?::jsonb,
                retry_count = ?,
                next_retry_at = ?,
                lease_owner = ?,
                lease_expires_at = ?,
                awaiting_signal_type = ?,
                cancel_requested = ?,
                completed_at = ?,
                error = ?
            WHERE execution_id = ?
            """;

        jdbcTemplate.update(sql,
            execution.status().name(),
            execution.currentNodeId(),
            json.toJson(execution.stateBlob()),
            execution.retryCount(),
            toTimestamp(execution.nextRetryAt()),
            execution.leaseOwner(),
            toTimestamp(execution.leaseExpiresAt()),
            execution.awaitingSignalType(),
            execution.cancelRequested(),
            toTimestamp(execution.completedAt()),
            execution.error(),
            execution.executionId()
        );
    }

    private void insertLogs(List<ExecutionLogEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO execution_logs (execution_id, node_id, level, message, logged_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, entries, entries.size(), (ps, entry) -> {
            ps.setString(1, entry.executionId());
            ps.setString(2, entry.nodeId());
            ps.setString(3, entry.level().name());
            ps.setString(4, entry.message());
            ps.setTimestamp(5, toTimestamp(entry.timestamp()));
        });
    }

    private void insertCheckpoint(ExecutionCheckpoint checkpoint) {
        String sql = """
            INSERT INTO execution_checkpoints (
                execution_id, sequence, node_id, next_node_id, state_json, created_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?)
            """;
        jdbcTemplate.update(sql,
            checkpoint.executionId(),
            checkpoint.sequence(),
            checkpoint.nodeId(),
            checkpoint.nextNodeId(),
            json.toJson(checkpoint.stateBlob()),
            toTimestamp(checkpoint.createdAt())
        );
    }

    private static class LogRowMapper implements RowMapper<ExecutionLogEntry> {
        @Override
        public ExecutionLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ExecutionLogEntry(
                rs.getString("execution_id"),
                rs.getLong("id"),
                rs.getString("node_id"),
                LogLevel.valueOf(rs.getString("level")),
                rs.getString("message"),
                toInstant(rs.getTimestamp("logged_at"))
            );
        }
    }
}
