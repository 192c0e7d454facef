package com.stepflow.engine.history;

import com.stepflow.core.model.ExecutionStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregated view of an execution's history.
 */
public record ExecutionSummary(
    String executionId,
    String workflowId,
    int workflowVersion,
    ExecutionStatus status,
    String currentNodeId,
    long nodesCompleted,
    int retryCount,
    long logCount,
    long errorCount,
    long signalCount,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Duration duration,
    String failedNodeId,
    String error,
    String replayOf
) {}
