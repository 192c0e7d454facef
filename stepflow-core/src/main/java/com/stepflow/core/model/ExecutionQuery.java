package com.stepflow.core.model;

/**
 * Filter for listing executions. Null fields match everything.
 */
public record ExecutionQuery(
    String workflowId,
    ExecutionStatus status,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public ExecutionQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        offset = Math.max(offset, 0);
    }

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, null, DEFAULT_LIMIT, 0);
    }
}
