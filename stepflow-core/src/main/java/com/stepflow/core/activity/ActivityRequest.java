package com.stepflow.core.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.NodeDefinition;

/**
 * Input of a single node invocation.
 *
 * @param executionId execution being stepped
 * @param workflowId workflow of the execution
 * @param workflowVersion pinned definition version
 * @param node node to invoke
 * @param state accumulated state blob
 * @param retryCount retries consumed by the execution so far
 * @param stepCount completed steps so far
 * @param heartbeat extends the caller's lease during long invocations
 */
public record ActivityRequest(
    String executionId,
    String workflowId,
    int workflowVersion,
    NodeDefinition node,
    JsonNode state,
    int retryCount,
    long stepCount,
    LeaseHeartbeat heartbeat
) {
    /**
     * Stable key for external calls made by this invocation.
     * Identical across retries of the same step, so downstream systems can deduplicate.
     */
    public String idempotencyKey() {
        return executionId + ":" + node.nodeId() + ":" + stepCount;
    }

    /**
     * Callback for lease renewal.
     */
    @FunctionalInterface
    public interface LeaseHeartbeat {

        /**
         * @return true if the lease is still held, false if it was lost
         */
        boolean beat();
    }
}
