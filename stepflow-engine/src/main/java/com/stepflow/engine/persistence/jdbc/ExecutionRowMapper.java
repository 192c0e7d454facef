package com.stepflow.engine.persistence.jdbc;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionStatus;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

import static com.stepflow.engine.persistence.jdbc.JsonColumns.toInstant;

/**
 * Maps a {@code workflow_executions} row.
 */
class ExecutionRowMapper implements RowMapper<Execution> {

    private final JsonColumns json;

    ExecutionRowMapper(JsonColumns json) {
        this.json = json;
    }

    @Override
    public Execution mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Execution.builder()
            .executionId(rs.getString("execution_id"))
            .workflowId(rs.getString("workflow_id"))
            .workflowVersion(rs.getInt("workflow_version"))
            .status(ExecutionStatus.valueOf(rs.getString("status")))
            .currentNodeId(rs.getString("current_node_id"))
            .stateBlob(json.fromJson(rs.getString("state_json")))
            .stepCount(rs.getLong("step_count"))
            .retryCount(rs.getInt("retry_count"))
            .nextRetryAt(toInstant(rs.getTimestamp("next_retry_at")))
            .leaseOwner(rs.getString("lease_owner"))
            .leaseExpiresAt(toInstant(rs.getTimestamp("lease_expires_at")))
            .awaitingSignalType(rs.getString("awaiting_signal_type"))
            .cancelRequested(rs.getBoolean("cancel_requested"))
            .triggerPayload(json.fromJson(rs.getString("trigger_json")))
            .replayOf(rs.getString("replay_of"))
            .replayFromNodeId(rs.getString("replay_from_node_id"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .startedAt(toInstant(rs.getTimestamp("started_at")))
            .completedAt(toInstant(rs.getTimestamp("completed_at")))
            .error(rs.getString("error"))
            .errorNodeId(rs.getString("error_node_id"))
            .build();
    }
}
