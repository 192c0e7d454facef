package com.stepflow.core.model;

/**
 * Paginated filter over an execution's log entries.
 * The limit defaults to {@value #DEFAULT_LIMIT} and is capped at {@value #MAX_LIMIT}.
 */
public record LogQuery(
    String executionId,
    String nodeId,
    LogLevel level,
    int offset,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public LogQuery {
        offset = Math.max(offset, 0);
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static LogQuery page(String executionId, int page, int size) {
        int safeSize = size <= 0 ? DEFAULT_LIMIT : Math.min(size, MAX_LIMIT);
        long offset = (long) Math.max(page, 0) * safeSize;
        return new LogQuery(executionId, null, null, (int) Math.min(offset, Integer.MAX_VALUE), safeSize);
    }
}
