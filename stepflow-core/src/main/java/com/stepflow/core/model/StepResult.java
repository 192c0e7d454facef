package com.stepflow.core.model;

import java.util.List;

/**
 * Everything one engine step writes, persisted atomically.
 *
 * @param execution execution row after the step; identity and lease fields are ignored
 * @param logEntries audit entries to append
 * @param checkpoint checkpoint of a successful node, null otherwise
 */
public record StepResult(
    Execution execution,
    List<ExecutionLogEntry> logEntries,
    ExecutionCheckpoint checkpoint
) {
    public StepResult {
        logEntries = logEntries == null ? List.of() : List.copyOf(logEntries);
    }

    public static StepResult of(Execution execution, List<ExecutionLogEntry> logEntries) {
        return new StepResult(execution, logEntries, null);
    }
}
