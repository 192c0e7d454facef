package com.stepflow.core.model;

/**
 * Lifecycle states for a workflow execution.
 * Transitions follow a strict state machine, see {@link #canTransitionTo}.
 */
public enum ExecutionStatus {
    /**
     * Created, not yet claimed by any worker.
     * Transitions: -> RUNNING, PAUSED, CANCELLED
     */
    PENDING,

    /**
     * A worker is (or was, before its lease expired) stepping through nodes.
     * Transitions: -> RUNNING, WAITING_SIGNAL, PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Suspended until a signal of the awaited type is delivered.
     * Transitions: -> RUNNING, PAUSED, CANCELLED
     */
    WAITING_SIGNAL,

    /**
     * Halted. With nextRetryAt set the execution waits out a retry backoff;
     * without it the execution was paused explicitly and waits for resume.
     * Transitions: -> RUNNING, CANCELLED
     */
    PAUSED,

    /**
     * Reached a node with no successors. Terminal state.
     */
    COMPLETED,

    /**
     * Fatal failure or retry budget exhausted. Terminal state, may be replayed.
     */
    FAILED,

    /**
     * Cancelled on request. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a worker may invoke activities in this state.
     */
    public boolean allowsExecution() {
        return this == RUNNING;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == PAUSED || target == CANCELLED;
            case RUNNING -> target == RUNNING || target == WAITING_SIGNAL || target == PAUSED ||
                           target == COMPLETED || target == FAILED || target == CANCELLED;
            case WAITING_SIGNAL -> target == RUNNING || target == PAUSED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == PAUSED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
