package com.stepflow.core.model;

import java.time.Instant;

/**
 * Append-only audit record of an execution.
 * The sequence is assigned by the store on append.
 */
public record ExecutionLogEntry(
    String executionId,
    long sequence,
    String nodeId,
    LogLevel level,
    String message,
    Instant timestamp
) {
    public static ExecutionLogEntry create(String executionId, String nodeId, LogLevel level,
                                           String message, Instant timestamp) {
        return new ExecutionLogEntry(executionId, 0L, nodeId, level, message, timestamp);
    }

    public static ExecutionLogEntry info(String executionId, String nodeId, String message, Instant timestamp) {
        return create(executionId, nodeId, LogLevel.INFO, message, timestamp);
    }

    public static ExecutionLogEntry error(String executionId, String nodeId, String message, Instant timestamp) {
        return create(executionId, nodeId, LogLevel.ERROR, message, timestamp);
    }

    public ExecutionLogEntry withSequence(long sequence) {
        return new ExecutionLogEntry(executionId, sequence, nodeId, level, message, timestamp);
    }
}
