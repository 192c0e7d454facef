package com.stepflow.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.LeaseLostException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.StepResult;
import com.stepflow.core.model.WorkflowDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of executions, their audit log and their checkpoints.
 *
 * The lease is the only concurrency control between workers: every mutating
 * call made on behalf of a worker is conditioned on that worker holding an
 * unexpired lease, and each call is one atomic transaction.
 */
public interface ExecutionStore {

    /**
     * Create a PENDING execution of the given definition version at its entry node.
     *
     * @param definition the version to pin
     * @param triggerPayload payload that started the execution
     * @return the stored execution
     */
    Execution createExecution(WorkflowDefinition definition, JsonNode triggerPayload);

    /**
     * Store a fully prepared execution (replay, scheduled trigger).
     *
     * @param execution the execution to insert
     * @return the stored execution
     * @throws IllegalArgumentException if the execution id already exists
     */
    default Execution createExecution(Execution execution) {
        return createExecution(execution, List.of());
    }

    /**
     * Store a fully prepared execution together with the log entries recording its creation,
     * in one transaction.
     *
     * @param execution the execution to insert
     * @param creationLogs entries appended to the new execution's log
     * @return the stored execution
     * @throws IllegalArgumentException if the execution id already exists
     */
    Execution createExecution(Execution execution, List<ExecutionLogEntry> creationLogs);

    /**
     * Atomically lease one eligible execution to the given worker.
     *
     * Eligible: PENDING or RUNNING with no live lease; PAUSED with nextRetryAt due;
     * WAITING_SIGNAL with an unprocessed signal of the awaited type; any non-terminal
     * execution with a pending cancellation. Oldest first. Two concurrent callers
     * never receive the same execution.
     *
     * @param workerId the claiming worker
     * @param leaseDuration how long the lease lasts without renewal
     * @return the leased execution, or empty if nothing is eligible
     */
    Optional<Execution> claim(String workerId, Duration leaseDuration);

    /**
     * Extend a held lease.
     *
     * @return the freshly read execution, including any cancellation request
     * @throws LeaseLostException if the worker no longer holds an unexpired lease
     */
    Execution renewLease(String executionId, String workerId, Duration leaseDuration);

    /**
     * Persist one engine step atomically: execution row, log entries, checkpoint.
     *
     * @return the stored execution
     * @throws LeaseLostException if the worker no longer holds an unexpired lease,
     *         or the stored execution is already terminal
     */
    Execution persistStep(String executionId, String workerId, StepResult step);

    /**
     * Release a lease held by the worker. No-op if the worker does not hold it.
     */
    void release(String executionId, String workerId);

    /**
     * Request cancellation. An execution without a live lease is cancelled
     * immediately; a leased one is cancelled by its worker at the next tick.
     *
     * @return the execution after the request
     * @throws NotFoundException if the execution does not exist
     * @throws InvalidStateTransitionException if the execution is terminal
     */
    Execution requestCancellation(String executionId, String reason);

    /**
     * Pause an execution that no worker holds. Paused executions are not claimable.
     *
     * @throws InvalidStateTransitionException if terminal or currently leased
     */
    Execution pause(String executionId);

    /**
     * Make a PAUSED or WAITING_SIGNAL execution due now.
     *
     * @throws InvalidStateTransitionException in any other status
     */
    Execution resume(String executionId);

    Optional<Execution> findById(String executionId);

    List<Execution> query(ExecutionQuery query);

    Map<ExecutionStatus, Long> countByStatus();

    /**
     * Count executions holding a lease that has not expired at the given instant.
     */
    long countActiveLeases(Instant now);

    /**
     * Append an audit entry outside of a step (trigger, replay, API actions).
     */
    void appendLog(ExecutionLogEntry entry);

    /**
     * Log entries in sequence order, filtered and paginated.
     */
    List<ExecutionLogEntry> findLogs(LogQuery query);

    /**
     * Count log entries matching the filter, ignoring pagination.
     */
    long countLogs(LogQuery query);

    /**
     * Checkpoints in sequence order.
     */
    List<ExecutionCheckpoint> findCheckpoints(String executionId);

    /**
     * Delete terminal executions completed before the cutoff, with their logs,
     * checkpoints and signals.
     *
     * @return number of executions deleted
     */
    int deleteTerminalBefore(Instant cutoff);
}
