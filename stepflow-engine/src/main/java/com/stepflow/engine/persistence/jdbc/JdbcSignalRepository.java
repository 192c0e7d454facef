package com.stepflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.Signal;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.statemachine.ExecutionStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.stepflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.stepflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of SignalRepository.
 */
@Repository("jdbcSignalRepository")
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcSignalRepository implements SignalRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSignalRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final JsonColumns json;
    private final ExecutionRowMapper executionRowMapper;
    private final RowMapper<Signal> rowMapper;

    public JdbcSignalRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.json = new JsonColumns(objectMapper);
        this.executionRowMapper = new ExecutionRowMapper(json);
        this.rowMapper = (rs, rowNum) -> new Signal(
            rs.getString("signal_id"),
            rs.getString("execution_id"),
            rs.getString("signal_type"),
            json.fromJson(rs.getString("payload_json")),
            toInstant(rs.getTimestamp("received_at")),
            rs.getBoolean("processed"),
            toInstant(rs.getTimestamp("processed_at"))
        );
    }

    @Override
    @Transactional
    public Signal record(Signal signal) {
        String sql = """
            INSERT INTO workflow_signals (
                signal_id, execution_id, signal_type, payload_json, received_at, processed, processed_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            signal.signalId(),
            signal.executionId(),
            signal.signalType(),
            json.toJson(signal.payload()),
            toTimestamp(signal.receivedAt()),
            signal.processed(),
            toTimestamp(signal.processedAt())
        );
        return signal;
    }

    @Override
    public Optional<Signal> findById(String signalId) {
        List<Signal> results = jdbcTemplate.query(
            "SELECT * FROM workflow_signals WHERE signal_id = ?", rowMapper, signalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Signal> findByExecution(String executionId) {
        String sql = """
            SELECT * FROM workflow_signals
            WHERE execution_id = ?
            ORDER BY received_at, signal_id
            """;
        return jdbcTemplate.query(sql, rowMapper, executionId);
    }

    @Override
    public Optional<Signal> findOldestUnprocessed(String executionId, String signalType) {
        String sql = """
            SELECT * FROM workflow_signals
            WHERE execution_id = ? AND signal_type = ? AND NOT processed
            ORDER BY received_at, signal_id
            LIMIT 1
            """;
        List<Signal> results = jdbcTemplate.query(sql, rowMapper, executionId, signalType);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public Optional<Execution> resumeWithSignal(String signalId, String workerId) {
        Instant now = clock.instant();
        Optional<Signal> found = findById(signalId);
        if (found.isEmpty() || found.get().processed()) {
            return Optional.empty();
        }
        Signal signal = found.get();

        List<Execution> rows = jdbcTemplate.query(
            "SELECT * FROM workflow_executions WHERE execution_id = ? FOR UPDATE",
            executionRowMapper, signal.executionId());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Execution execution = rows.get(0);
        if (execution.status() != ExecutionStatus.WAITING_SIGNAL
                || !signal.signalType().equals(execution.awaitingSignalType())) {
            return Optional.empty();
        }
        if (execution.isLeased(now) && !execution.isLeasedBy(workerId, now)) {
            return Optional.empty();
        }

        int consumed = jdbcTemplate.update("""
            UPDATE workflow_signals SET
                processed = TRUE,
                processed_at = ?
            WHERE signal_id = ? AND NOT processed
            """, toTimestamp(now), signalId);
        if (consumed == 0) {
            log.debug("Signal {} was consumed concurrently", signalId);
            return Optional.empty();
        }

        Execution resumed = ExecutionStateMachine.onSignal(execution, signal, now);
        jdbcTemplate.update("""
            UPDATE workflow_executions SET
                status = ?,
                state_json = ?::jsonb,
                awaiting_signal_type = NULL
            WHERE execution_id = ?
            """,
            resumed.status().name(),
            json.toJson(resumed.stateBlob()),
            resumed.executionId()
        );
        jdbcTemplate.update("""
            INSERT INTO execution_logs (execution_id, node_id, level, message, logged_at)
            VALUES (?, ?, 'INFO', ?, ?)
            """,
            resumed.executionId(),
            resumed.currentNodeId(),
            "Resumed by signal " + signal.signalType(),
            toTimestamp(now)
        );
        return Optional.of(resumed);
    }
}
