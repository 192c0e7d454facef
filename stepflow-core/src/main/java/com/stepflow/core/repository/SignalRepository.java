package com.stepflow.core.repository;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.Signal;

import java.util.List;
import java.util.Optional;

/**
 * Repository for signals addressed to executions.
 */
public interface SignalRepository {

    /**
     * Record a received signal as unprocessed.
     */
    Signal record(Signal signal);

    Optional<Signal> findById(String signalId);

    /**
     * All signals of an execution in arrival order.
     */
    List<Signal> findByExecution(String executionId);

    /**
     * Oldest unprocessed signal of the given type, if any.
     */
    Optional<Signal> findOldestUnprocessed(String executionId, String signalType);

    /**
     * Consume a signal and resume its execution, atomically.
     *
     * Marks the signal processed only if it was unprocessed, and flips the execution
     * from WAITING_SIGNAL to RUNNING only if it awaits this signal's type and holds
     * no live lease other than {@code workerId}'s. The payload is merged into the
     * execution's state blob. Either both updates happen or neither does.
     *
     * @param signalId the signal to consume
     * @param workerId worker holding the execution's lease, or null when the caller holds none
     * @return the resumed execution, or empty if either condition failed
     */
    Optional<Execution> resumeWithSignal(String signalId, String workerId);
}
