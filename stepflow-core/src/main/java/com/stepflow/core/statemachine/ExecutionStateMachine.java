package com.stepflow.core.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.model.ErrorClass;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogLevel;
import com.stepflow.core.model.NodeOutcome;
import com.stepflow.core.model.RetryDecision;
import com.stepflow.core.model.RetryPolicy;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.StateBlob;
import com.stepflow.core.model.WorkflowDefinition;

import java.time.Instant;
import java.util.List;

/**
 * Pure transition function of the execution lifecycle.
 * No I/O: every method maps an execution (plus input) to its successor.
 *
 * <pre>
 * PENDING --claim--> RUNNING --success--> RUNNING (next node)
 *                            --success at terminal node--> COMPLETED
 *                            --suspend--> WAITING_SIGNAL --signal--> RUNNING
 *                            --retryable, budget left--> PAUSED --due + claim--> RUNNING
 *                            --fatal / budget exhausted--> FAILED
 * any non-terminal --cancel--> CANCELLED
 * </pre>
 */
public final class ExecutionStateMachine {

    private ExecutionStateMachine() {
    }

    /**
     * Apply the outcome of invoking the current node of a RUNNING execution.
     *
     * @param execution execution in RUNNING status
     * @param outcome result of invoking {@code execution.currentNodeId()}
     * @param graph the pinned workflow definition
     * @param retryPolicy effective retry policy
     * @param now evaluation instant
     * @return the transition to persist
     * @throws InvalidStateTransitionException if the execution is not RUNNING
     */
    public static Transition transition(Execution execution, NodeOutcome outcome,
                                        WorkflowDefinition graph, RetryPolicy retryPolicy, Instant now) {
        if (execution.status() != ExecutionStatus.RUNNING) {
            throw new InvalidStateTransitionException(
                execution.executionId(), execution.status(), "apply node outcome to");
        }

        return switch (outcome.status()) {
            case SUCCESS -> onSuccess(execution, outcome, graph, now);
            case RETRYABLE_FAILURE -> onRetryableFailure(execution, outcome, retryPolicy, now);
            case FATAL_FAILURE -> fail(execution, outcome.describeError(),
                "Node " + execution.currentNodeId() + " failed permanently: " + outcome.describeError(), now);
            case SUSPEND -> onSuspend(execution, outcome, now);
        };
    }

    /**
     * Move a claimed PENDING or due PAUSED execution into RUNNING.
     * A RUNNING execution, reclaimed after its lease expired, is returned unchanged.
     */
    public static Execution onClaim(Execution execution, Instant now) {
        ExecutionStatus status = execution.status();
        if (status == ExecutionStatus.RUNNING) {
            return execution;
        }
        if (status != ExecutionStatus.PENDING && status != ExecutionStatus.PAUSED) {
            throw new InvalidStateTransitionException(status, ExecutionStatus.RUNNING);
        }
        return execution.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .startedAt(execution.startedAt() != null ? execution.startedAt() : now)
            .nextRetryAt(null)
            .awaitingSignalType(null)
            .build();
    }

    /**
     * Cancel a non-terminal execution. Always allowed before completion.
     */
    public static Transition onCancel(Execution execution, String reason, Instant now) {
        if (execution.isTerminal()) {
            throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.CANCELLED);
        }
        Execution cancelled = execution.toBuilder()
            .status(ExecutionStatus.CANCELLED)
            .cancelRequested(true)
            .nextRetryAt(null)
            .awaitingSignalType(null)
            .completedAt(now)
            .error(reason)
            .build();
        String message = reason != null ? "Execution cancelled: " + reason : "Execution cancelled";
        return new Transition(cancelled,
            List.of(log(execution, LogLevel.INFO, message, now)), null);
    }

    /**
     * Resume a WAITING_SIGNAL execution with the payload of a matching signal.
     */
    public static Execution onSignal(Execution execution, Signal signal, Instant now) {
        if (execution.status() != ExecutionStatus.WAITING_SIGNAL) {
            throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.RUNNING);
        }
        if (!signal.signalType().equals(execution.awaitingSignalType())) {
            throw new InvalidStateTransitionException(
                execution.executionId(), execution.status(), "deliver signal " + signal.signalType() + " to");
        }
        return execution.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .stateBlob(StateBlob.withReceivedSignal(
                StateBlob.withSignal(execution.stateBlob(), signal.signalType(), signal.payload()),
                execution.currentNodeId(), signal.payload()))
            .awaitingSignalType(null)
            .build();
    }

    /**
     * Pause an idle execution on request. Paused executions are not claimable until resumed.
     */
    public static Execution onPause(Execution execution) {
        ExecutionStatus status = execution.status();
        if (status.isTerminal()) {
            throw new InvalidStateTransitionException(status, ExecutionStatus.PAUSED);
        }
        return execution.toBuilder()
            .status(ExecutionStatus.PAUSED)
            .nextRetryAt(null)
            .awaitingSignalType(null)
            .build();
    }

    /**
     * Make a PAUSED (or WAITING_SIGNAL) execution due immediately.
     * The current node is invoked again on the next claim.
     */
    public static Execution onResume(Execution execution, Instant now) {
        ExecutionStatus status = execution.status();
        if (status != ExecutionStatus.PAUSED && status != ExecutionStatus.WAITING_SIGNAL) {
            throw new InvalidStateTransitionException(
                execution.executionId(), status, "resume");
        }
        return execution.toBuilder()
            .status(ExecutionStatus.PAUSED)
            .nextRetryAt(now)
            .awaitingSignalType(null)
            .build();
    }

    private static Transition onSuccess(Execution execution, NodeOutcome outcome,
                                        WorkflowDefinition graph, Instant now) {
        String nodeId = execution.currentNodeId();
        JsonNode blob = StateBlob.withOutput(execution.stateBlob(), nodeId, outcome.output());
        List<String> successors = graph.successorsOf(nodeId);
        long step = execution.stepCount() + 1;

        String nextNodeId;
        if (outcome.nextNodeId() != null) {
            if (!successors.contains(outcome.nextNodeId())) {
                String error = "Node " + nodeId + " selected undeclared successor " + outcome.nextNodeId();
                return fail(execution, error, error, now);
            }
            nextNodeId = outcome.nextNodeId();
        } else if (successors.isEmpty()) {
            nextNodeId = null;
        } else {
            nextNodeId = successors.get(0);
        }

        ExecutionCheckpoint checkpoint = new ExecutionCheckpoint(
            execution.executionId(), step, nodeId, nextNodeId, blob, now);

        if (nextNodeId == null) {
            Execution completed = execution.toBuilder()
                .status(ExecutionStatus.COMPLETED)
                .stateBlob(blob)
                .stepCount(step)
                .nextRetryAt(null)
                .error(null)
                .errorNodeId(null)
                .completedAt(now)
                .build();
            return new Transition(completed, List.of(
                log(execution, LogLevel.INFO, "Node " + nodeId + " completed", now),
                log(execution, LogLevel.INFO, "Execution completed", now)
            ), checkpoint);
        }

        Execution advanced = execution.toBuilder()
            .currentNodeId(nextNodeId)
            .stateBlob(blob)
            .stepCount(step)
            .nextRetryAt(null)
            .error(null)
            .errorNodeId(null)
            .build();
        return new Transition(advanced, List.of(
            log(execution, LogLevel.INFO, "Node " + nodeId + " completed, next node " + nextNodeId, now)
        ), checkpoint);
    }

    private static Transition onRetryableFailure(Execution execution, NodeOutcome outcome,
                                                 RetryPolicy retryPolicy, Instant now) {
        RetryDecision decision = retryPolicy.decide(execution.retryCount(), ErrorClass.RETRYABLE, now);
        String error = outcome.describeError();

        if (!decision.retry()) {
            return fail(execution, error, String.format("Node %s failed after %d retries: %s",
                execution.currentNodeId(), execution.retryCount(), error), now);
        }

        int retryCount = execution.retryCount() + 1;
        Execution paused = execution.toBuilder()
            .status(ExecutionStatus.PAUSED)
            .retryCount(retryCount)
            .nextRetryAt(decision.retryAt())
            .error(error)
            .errorNodeId(execution.currentNodeId())
            .build();
        return new Transition(paused, List.of(log(execution, LogLevel.WARNING, String.format(
            "Node %s failed, retry %d of %d scheduled at %s: %s",
            execution.currentNodeId(), retryCount, retryPolicy.maxRetries(), decision.retryAt(), error), now)
        ), null);
    }

    private static Transition onSuspend(Execution execution, NodeOutcome outcome, Instant now) {
        String signalType = outcome.awaitSignalType();
        if (signalType == null || signalType.isBlank()) {
            String error = "Node " + execution.currentNodeId() + " suspended without a signal type";
            return fail(execution, error, error, now);
        }
        Execution waiting = execution.toBuilder()
            .status(ExecutionStatus.WAITING_SIGNAL)
            .awaitingSignalType(signalType)
            .nextRetryAt(null)
            .build();
        return new Transition(waiting, List.of(log(execution, LogLevel.INFO,
            "Node " + execution.currentNodeId() + " waiting for signal " + signalType, now)), null);
    }

    private static Transition fail(Execution execution, String error, String message, Instant now) {
        Execution failed = execution.toBuilder()
            .status(ExecutionStatus.FAILED)
            .nextRetryAt(null)
            .error(error)
            .errorNodeId(execution.currentNodeId())
            .completedAt(now)
            .build();
        return new Transition(failed, List.of(log(execution, LogLevel.ERROR, message, now)), null);
    }

    private static ExecutionLogEntry log(Execution execution, LogLevel level, String message, Instant now) {
        return ExecutionLogEntry.create(execution.executionId(), execution.currentNodeId(), level, message, now);
    }
}
