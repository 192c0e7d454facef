package com.stepflow.engine.persistence;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.WorkflowDefinition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared tables of the in-memory stores.
 * Every access happens while holding {@link #lock()}, which gives each
 * repository call the all-or-nothing behavior of a database transaction.
 * For demonstration and testing purposes.
 */
@Component
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "memory")
public class InMemoryDatabase {

    private final Object lock = new Object();

    final Map<String, Execution> executions = new LinkedHashMap<>();
    final Map<String, List<ExecutionLogEntry>> logs = new HashMap<>();
    final Map<String, List<ExecutionCheckpoint>> checkpoints = new HashMap<>();
    final Map<String, Signal> signals = new LinkedHashMap<>();
    final Map<String, Schedule> schedules = new LinkedHashMap<>();
    final Map<String, TreeMap<Integer, WorkflowDefinition>> definitions = new HashMap<>();
    private long logSequence;

    public Object lock() {
        return lock;
    }

    ExecutionLogEntry appendLog(ExecutionLogEntry entry) {
        ExecutionLogEntry sequenced = entry.withSequence(++logSequence);
        logs.computeIfAbsent(entry.executionId(), k -> new ArrayList<>()).add(sequenced);
        return sequenced;
    }

    boolean hasUnprocessedSignal(String executionId, String signalType) {
        return signals.values().stream()
            .anyMatch(s -> !s.processed()
                && s.executionId().equals(executionId)
                && s.signalType().equals(signalType));
    }

    void deleteExecution(String executionId) {
        executions.remove(executionId);
        logs.remove(executionId);
        checkpoints.remove(executionId);
        signals.values().removeIf(s -> s.executionId().equals(executionId));
    }
}
