package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Snapshot of an execution's state right after a node completed successfully.
 * Replay from {@code nextNodeId} starts from {@code stateBlob}.
 *
 * @param executionId owning execution
 * @param sequence step number of the completed node, unique per execution
 * @param nodeId node that completed
 * @param nextNodeId node selected to run next, null when the execution completed
 * @param stateBlob accumulated state including the completed node's output
 * @param createdAt when the step was persisted
 */
public record ExecutionCheckpoint(
    String executionId,
    long sequence,
    String nodeId,
    String nextNodeId,
    JsonNode stateBlob,
    Instant createdAt
) {
}
