package com.stepflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.InvalidReplayTargetException;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogLevel;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.StateBlob;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Service for execution history and replay.
 *
 * Provides:
 * - Paginated audit log retrieval
 * - Checkpoint and signal history
 * - Execution summaries
 * - Replay of failed executions from a checkpoint
 */
@Service
public class ExecutionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);

    private final ExecutionStore store;
    private final SignalRepository signalRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final ExecutionMetrics metrics;
    private final Clock clock;

    public ExecutionHistoryService(ExecutionStore store,
                                   SignalRepository signalRepository,
                                   WorkflowDefinitionRepository definitionRepository,
                                   ExecutionMetrics metrics,
                                   Clock clock) {
        this.store = store;
        this.signalRepository = signalRepository;
        this.definitionRepository = definitionRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Get one page of an execution's log, optionally filtered by node and level.
     */
    public LogPage getLogs(LogQuery query) {
        requireExecution(query.executionId());
        List<ExecutionLogEntry> entries = store.findLogs(query);
        long total = store.countLogs(query);
        return new LogPage(entries, total, query.offset(), query.limit());
    }

    public List<ExecutionCheckpoint> getCheckpoints(String executionId) {
        requireExecution(executionId);
        return store.findCheckpoints(executionId);
    }

    public List<Signal> getSignals(String executionId) {
        requireExecution(executionId);
        return signalRepository.findByExecution(executionId);
    }

    /**
     * Summarize an execution: progress, failures and timing.
     */
    public ExecutionSummary getSummary(String executionId) {
        Execution execution = requireExecution(executionId);
        long nodesCompleted = store.findCheckpoints(executionId).size();
        long logCount = store.countLogs(new LogQuery(executionId, null, null, 0, 0));
        long errorCount = store.countLogs(new LogQuery(executionId, null, LogLevel.ERROR, 0, 0));
        long signalCount = signalRepository.findByExecution(executionId).size();

        Duration duration = null;
        if (execution.startedAt() != null) {
            Instant end = execution.completedAt() != null ? execution.completedAt() : clock.instant();
            duration = Duration.between(execution.startedAt(), end);
        }

        return new ExecutionSummary(
            execution.executionId(),
            execution.workflowId(),
            execution.workflowVersion(),
            execution.status(),
            execution.currentNodeId(),
            nodesCompleted,
            execution.retryCount(),
            logCount,
            errorCount,
            signalCount,
            execution.createdAt(),
            execution.startedAt(),
            execution.completedAt(),
            duration,
            execution.status() == ExecutionStatus.FAILED ? execution.errorNodeId() : null,
            execution.error(),
            execution.replayOf()
        );
    }

    /**
     * Start a new execution that resumes a FAILED one from {@code fromNodeId}.
     *
     * The target must be the entry node, or a node some checkpoint of the failed
     * execution pointed to next. The new execution starts from the state of the
     * latest such checkpoint, so nodes before the target are never invoked again.
     *
     * @param executionId the failed execution
     * @param fromNodeId node to restart from, null for the node that failed
     * @return the new PENDING execution
     */
    public Execution replay(String executionId, String fromNodeId) {
        Execution failed = requireExecution(executionId);
        if (failed.status() != ExecutionStatus.FAILED) {
            throw new InvalidStateTransitionException(executionId, failed.status(), "replay");
        }
        String target = fromNodeId != null ? fromNodeId : failed.currentNodeId();

        WorkflowDefinition definition = definitionRepository.find(failed.workflowId(), failed.workflowVersion())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition",
                failed.workflowId() + ":" + failed.workflowVersion()));
        if (definition.getNode(target).isEmpty()) {
            throw new InvalidReplayTargetException(executionId, target);
        }

        JsonNode state;
        long stepCount;
        ExecutionCheckpoint checkpoint = store.findCheckpoints(executionId).stream()
            .filter(c -> target.equals(c.nextNodeId()))
            .max(Comparator.comparingLong(ExecutionCheckpoint::sequence))
            .orElse(null);
        if (checkpoint != null) {
            state = checkpoint.stateBlob();
            stepCount = checkpoint.sequence();
        } else if (target.equals(definition.entryNodeId())) {
            state = StateBlob.initial(failed.triggerPayload());
            stepCount = 0;
        } else {
            throw new InvalidReplayTargetException(executionId, target);
        }

        Instant now = clock.instant();
        Execution replay = Execution.builder()
            .executionId(UUID.randomUUID().toString())
            .workflowId(failed.workflowId())
            .workflowVersion(failed.workflowVersion())
            .status(ExecutionStatus.PENDING)
            .currentNodeId(target)
            .stateBlob(state)
            .stepCount(stepCount)
            .retryCount(0)
            .triggerPayload(failed.triggerPayload())
            .replayOf(executionId)
            .replayFromNodeId(target)
            .createdAt(now)
            .build();

        store.createExecution(replay, List.of(ExecutionLogEntry.info(replay.executionId(), target,
            "Replay of " + executionId + " started from node " + target, now)));
        metrics.executionCreated(replay.workflowId(), "replay");

        log.info("Replaying execution {} from node {} as {}", executionId, target, replay.executionId());
        return replay;
    }

    private Execution requireExecution(String executionId) {
        return store.findById(executionId)
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }
}
