package com.stepflow.core.statemachine;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.StepResult;

import java.util.List;

/**
 * Result of applying a node outcome to an execution.
 *
 * @param execution the execution after the transition
 * @param logEntries audit entries describing the transition
 * @param checkpoint checkpoint to record, null unless a node completed
 */
public record Transition(
    Execution execution,
    List<ExecutionLogEntry> logEntries,
    ExecutionCheckpoint checkpoint
) {
    public Transition {
        logEntries = logEntries == null ? List.of() : List.copyOf(logEntries);
    }

    public ExecutionStatus status() {
        return execution.status();
    }

    public StepResult toStepResult() {
        return new StepResult(execution, logEntries, checkpoint);
    }
}
