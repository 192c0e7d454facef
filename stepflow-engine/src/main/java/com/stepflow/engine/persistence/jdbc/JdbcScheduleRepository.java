package com.stepflow.engine.persistence.jdbc;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.ScheduleRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.stepflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.stepflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of ScheduleRepository.
 * The triggered execution is inserted through the ExecutionStore inside the
 * same transaction as the schedule advance.
 */
@Repository("jdbcScheduleRepository")
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcScheduleRepository implements ScheduleRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ExecutionStore executionStore;
    private final RowMapper<Schedule> rowMapper = new ScheduleRowMapper();

    public JdbcScheduleRepository(JdbcTemplate jdbcTemplate, ExecutionStore executionStore) {
        this.jdbcTemplate = jdbcTemplate;
        this.executionStore = executionStore;
    }

    @Override
    @Transactional
    public Schedule save(Schedule schedule) {
        String sql = """
            INSERT INTO workflow_schedules (
                schedule_id, workflow_id, cron_expression, active, next_run_at, last_run_at, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (schedule_id) DO UPDATE SET
                cron_expression = EXCLUDED.cron_expression,
                active = EXCLUDED.active,
                next_run_at = EXCLUDED.next_run_at,
                last_run_at = EXCLUDED.last_run_at
            """;

        jdbcTemplate.update(sql,
            schedule.scheduleId(),
            schedule.workflowId(),
            schedule.cronExpression(),
            schedule.active(),
            toTimestamp(schedule.nextRunAt()),
            toTimestamp(schedule.lastRunAt()),
            toTimestamp(schedule.createdAt())
        );
        return schedule;
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        List<Schedule> results = jdbcTemplate.query(
            "SELECT * FROM workflow_schedules WHERE schedule_id = ?", rowMapper, scheduleId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Schedule> findByWorkflow(String workflowId) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_schedules WHERE workflow_id = ? ORDER BY created_at",
            rowMapper, workflowId);
    }

    @Override
    public List<Schedule> findAll() {
        return jdbcTemplate.query("SELECT * FROM workflow_schedules ORDER BY created_at", rowMapper);
    }

    @Override
    public List<Schedule> findDue(Instant now, int limit) {
        String sql = """
            SELECT * FROM workflow_schedules
            WHERE active AND next_run_at IS NOT NULL AND next_run_at <= ?
            ORDER BY next_run_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, toTimestamp(now), limit);
    }

    @Override
    @Transactional
    public boolean setActive(String scheduleId, boolean active) {
        int rows = jdbcTemplate.update(
            "UPDATE workflow_schedules SET active = ? WHERE schedule_id = ?", active, scheduleId);
        return rows > 0;
    }

    @Override
    @Transactional
    public boolean advanceAndTrigger(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt,
                                     Instant firedAt, Execution toCreate,
                                     List<ExecutionLogEntry> creationLogs) {
        String sql = """
            UPDATE workflow_schedules SET
                next_run_at = ?,
                last_run_at = ?
            WHERE schedule_id = ? AND active AND next_run_at = ?
            """;

        int rows = jdbcTemplate.update(sql,
            toTimestamp(newNextRunAt),
            toTimestamp(firedAt),
            scheduleId,
            toTimestamp(expectedNextRunAt)
        );
        if (rows == 0) {
            return false;
        }
        if (toCreate != null) {
            executionStore.createExecution(toCreate, creationLogs);
        }
        return true;
    }

    private static class ScheduleRowMapper implements RowMapper<Schedule> {
        @Override
        public Schedule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Schedule(
                rs.getString("schedule_id"),
                rs.getString("workflow_id"),
                rs.getString("cron_expression"),
                rs.getBoolean("active"),
                toInstant(rs.getTimestamp("next_run_at")),
                toInstant(rs.getTimestamp("last_run_at")),
                toInstant(rs.getTimestamp("created_at"))
            );
        }
    }
}
