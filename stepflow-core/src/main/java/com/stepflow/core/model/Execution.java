package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * One run of a specific workflow version.
 *
 * Invariants:
 * - workflowVersion never changes after creation
 * - terminal statuses are never left
 * - leaseOwner and leaseExpiresAt are both set or both null
 * - retryCount only grows
 */
public record Execution(
    // Identity
    String executionId,
    String workflowId,
    int workflowVersion,

    // Progress
    ExecutionStatus status,
    String currentNodeId,
    JsonNode stateBlob,
    long stepCount,

    // Retry
    int retryCount,
    Instant nextRetryAt,

    // Lease
    String leaseOwner,
    Instant leaseExpiresAt,

    // Suspension and cancellation
    String awaitingSignalType,
    boolean cancelRequested,

    // Origin
    JsonNode triggerPayload,
    String replayOf,
    String replayFromNodeId,

    // Timing and failure
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String error,
    String errorNodeId
) {
    /**
     * Create a new PENDING execution at the entry node of the given definition.
     */
    public static Execution create(WorkflowDefinition definition, JsonNode triggerPayload, Instant now) {
        return builder()
            .executionId(UUID.randomUUID().toString())
            .workflowId(definition.workflowId())
            .workflowVersion(definition.version())
            .status(ExecutionStatus.PENDING)
            .currentNodeId(definition.entryNodeId())
            .stateBlob(StateBlob.initial(triggerPayload))
            .triggerPayload(triggerPayload)
            .createdAt(now)
            .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Check if a worker holds an unexpired lease at the given instant.
     */
    public boolean isLeased(Instant now) {
        return leaseOwner != null && leaseExpiresAt != null && leaseExpiresAt.isAfter(now);
    }

    /**
     * Check if the lease is held by the given worker at the given instant.
     */
    public boolean isLeasedBy(String workerId, Instant now) {
        return isLeased(now) && leaseOwner.equals(workerId);
    }

    /**
     * A PAUSED execution without a retry instant was paused on request.
     */
    public boolean isExplicitlyPaused() {
        return status == ExecutionStatus.PAUSED && nextRetryAt == null;
    }

    public Builder toBuilder() {
        return new Builder()
            .executionId(executionId)
            .workflowId(workflowId)
            .workflowVersion(workflowVersion)
            .status(status)
            .currentNodeId(currentNodeId)
            .stateBlob(stateBlob)
            .stepCount(stepCount)
            .retryCount(retryCount)
            .nextRetryAt(nextRetryAt)
            .leaseOwner(leaseOwner)
            .leaseExpiresAt(leaseExpiresAt)
            .awaitingSignalType(awaitingSignalType)
            .cancelRequested(cancelRequested)
            .triggerPayload(triggerPayload)
            .replayOf(replayOf)
            .replayFromNodeId(replayFromNodeId)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .error(error)
            .errorNodeId(errorNodeId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String executionId;
        private String workflowId;
        private int workflowVersion;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String currentNodeId;
        private JsonNode stateBlob;
        private long stepCount;
        private int retryCount;
        private Instant nextRetryAt;
        private String leaseOwner;
        private Instant leaseExpiresAt;
        private String awaitingSignalType;
        private boolean cancelRequested;
        private JsonNode triggerPayload;
        private String replayOf;
        private String replayFromNodeId;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private String error;
        private String errorNodeId;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder workflowVersion(int workflowVersion) {
            this.workflowVersion = workflowVersion;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentNodeId(String currentNodeId) {
            this.currentNodeId = currentNodeId;
            return this;
        }

        public Builder stateBlob(JsonNode stateBlob) {
            this.stateBlob = stateBlob;
            return this;
        }

        public Builder stepCount(long stepCount) {
            this.stepCount = stepCount;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder nextRetryAt(Instant nextRetryAt) {
            this.nextRetryAt = nextRetryAt;
            return this;
        }

        public Builder leaseOwner(String leaseOwner) {
            this.leaseOwner = leaseOwner;
            return this;
        }

        public Builder leaseExpiresAt(Instant leaseExpiresAt) {
            this.leaseExpiresAt = leaseExpiresAt;
            return this;
        }

        public Builder awaitingSignalType(String awaitingSignalType) {
            this.awaitingSignalType = awaitingSignalType;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder triggerPayload(JsonNode triggerPayload) {
            this.triggerPayload = triggerPayload;
            return this;
        }

        public Builder replayOf(String replayOf) {
            this.replayOf = replayOf;
            return this;
        }

        public Builder replayFromNodeId(String replayFromNodeId) {
            this.replayFromNodeId = replayFromNodeId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder errorNodeId(String errorNodeId) {
            this.errorNodeId = errorNodeId;
            return this;
        }

        public Execution build() {
            return new Execution(
                executionId, workflowId, workflowVersion,
                status, currentNodeId, stateBlob, stepCount,
                retryCount, nextRetryAt,
                leaseOwner, leaseExpiresAt,
                awaitingSignalType, cancelRequested,
                triggerPayload, replayOf, replayFromNodeId,
                createdAt, startedAt, completedAt, error, errorNodeId
            );
        }
    }
}
