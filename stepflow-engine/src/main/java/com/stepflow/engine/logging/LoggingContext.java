package com.stepflow.engine.logging;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the identifiers of the execution being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forExecution(executionId, workflowId, nodeId, retryCount)) {
 *     log.info("Invoking node"); // Automatically includes executionId, nodeId
 * }
 * </pre>
 *
 * Closing the context restores whatever values the keys held before it was opened,
 * so contexts nest: a worker context may wrap several execution contexts.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String NODE_ID = "nodeId";
    public static final String RETRY_COUNT = "retryCount";
    public static final String WORKER_ID = "workerId";
    public static final String SCHEDULE_ID = "scheduleId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new HashMap<>();

    private LoggingContext() {
        // Use static factory methods
    }

    /**
     * Create a logging context for one engine tick.
     */
    public static LoggingContext forExecution(String executionId, String workflowId, String nodeId, int retryCount) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(EXECUTION_ID, executionId);
        ctx.put(WORKFLOW_ID, workflowId);
        ctx.put(NODE_ID, nodeId);
        ctx.put(RETRY_COUNT, String.valueOf(retryCount));
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a worker loop.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        return ctx;
    }

    /**
     * Create a logging context for one schedule firing.
     */
    public static LoggingContext forSchedule(String scheduleId, String workflowId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(SCHEDULE_ID, scheduleId);
        ctx.put(WORKFLOW_ID, workflowId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Update the node of the current context as the engine advances.
     */
    public static void setNodeId(String nodeId) {
        if (nodeId != null) {
            MDC.put(NODE_ID, nodeId);
        }
    }

    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
    }
}
