package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of invoking the activity behind one node.
 *
 * @param status result kind
 * @param output node output merged into the state blob on success
 * @param errorCode machine-readable failure code
 * @param errorDetail human-readable failure detail
 * @param nextNodeId successor chosen by the node, null for the first declared edge
 * @param awaitSignalType signal type to wait for when suspending
 */
public record NodeOutcome(
    OutcomeStatus status,
    JsonNode output,
    String errorCode,
    String errorDetail,
    String nextNodeId,
    String awaitSignalType
) {
    public static NodeOutcome success(JsonNode output) {
        return new NodeOutcome(OutcomeStatus.SUCCESS, output, null, null, null, null);
    }

    public static NodeOutcome successTo(JsonNode output, String nextNodeId) {
        return new NodeOutcome(OutcomeStatus.SUCCESS, output, null, null, nextNodeId, null);
    }

    public static NodeOutcome retryable(String errorCode, String errorDetail) {
        return new NodeOutcome(OutcomeStatus.RETRYABLE_FAILURE, null, errorCode, errorDetail, null, null);
    }

    public static NodeOutcome fatal(String errorCode, String errorDetail) {
        return new NodeOutcome(OutcomeStatus.FATAL_FAILURE, null, errorCode, errorDetail, null, null);
    }

    public static NodeOutcome suspend(String awaitSignalType) {
        return new NodeOutcome(OutcomeStatus.SUSPEND, null, null, null, null, awaitSignalType);
    }

    public boolean isFailure() {
        return status == OutcomeStatus.RETRYABLE_FAILURE || status == OutcomeStatus.FATAL_FAILURE;
    }

    /**
     * Describe the failure for the execution's error field.
     */
    public String describeError() {
        if (errorCode == null) {
            return errorDetail;
        }
        return errorDetail == null ? errorCode : errorCode + ": " + errorDetail;
    }
}
