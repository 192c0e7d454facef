package com.stepflow.engine.persistence;

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
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.statemachine.ExecutionStateMachine;
import com.stepflow.core.statemachine.Transition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of ExecutionStore.
 * For demonstration and testing purposes.
 */
@Repository
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "memory")
public class InMemoryExecutionStore implements ExecutionStore {

    private final InMemoryDatabase db;
    private final Clock clock;

    public InMemoryExecutionStore(InMemoryDatabase db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Execution createExecution(WorkflowDefinition definition, JsonNode triggerPayload) {
        return createExecution(Execution.create(definition, triggerPayload, clock.instant()));
    }

    @Override
    public Execution createExecution(Execution execution, List<ExecutionLogEntry> creationLogs) {
        synchronized (db.lock()) {
            if (db.executions.containsKey(execution.executionId())) {
                throw new IllegalArgumentException("Execution already exists: " + execution.executionId());
            }
            db.executions.put(execution.executionId(), execution);
            creationLogs.forEach(db::appendLog);
            return execution;
        }
    }

    @Override
    public Optional<Execution> claim(String workerId, Duration leaseDuration) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Optional<Execution> candidate = db.executions.values().stream()
                .filter(e -> isClaimable(e, now))
                .findFirst();

            return candidate.map(e -> {
                Execution leased = e.toBuilder()
                    .leaseOwner(workerId)
                    .leaseExpiresAt(now.plus(leaseDuration))
                    .build();
                db.executions.put(leased.executionId(), leased);
                return leased;
            });
        }
    }

    private boolean isClaimable(Execution e, Instant now) {
        if (e.isTerminal() || e.isLeased(now)) {
            return false;
        }
        if (e.cancelRequested()) {
            return true;
        }
        return switch (e.status()) {
            case PENDING, RUNNING -> true;
            case PAUSED -> e.nextRetryAt() != null && !e.nextRetryAt().isAfter(now);
            case WAITING_SIGNAL -> db.hasUnprocessedSignal(e.executionId(), e.awaitingSignalType());
            default -> false;
        };
    }

    @Override
    public Execution renewLease(String executionId, String workerId, Duration leaseDuration) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Execution stored = db.executions.get(executionId);
            if (stored == null || !stored.isLeasedBy(workerId, now)) {
                throw new LeaseLostException(executionId, workerId);
            }
            Execution renewed = stored.toBuilder()
                .leaseExpiresAt(now.plus(leaseDuration))
                .build();
            db.executions.put(executionId, renewed);
            return renewed;
        }
    }

    @Override
    public Execution persistStep(String executionId, String workerId, StepResult step) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Execution stored = db.executions.get(executionId);
            if (stored == null || stored.isTerminal() || !stored.isLeasedBy(workerId, now)) {
                throw new LeaseLostException(executionId, workerId);
            }

            Execution next = step.execution();
            Execution merged = stored.toBuilder()
                .status(next.status())
                .currentNodeId(next.currentNodeId())
                .stateBlob(next.stateBlob())
                .stepCount(next.stepCount())
                .retryCount(next.retryCount())
                .nextRetryAt(next.nextRetryAt())
                .awaitingSignalType(next.awaitingSignalType())
                .cancelRequested(stored.cancelRequested() || next.cancelRequested())
                .startedAt(next.startedAt())
                .completedAt(next.completedAt())
                .error(next.error())
                .errorNodeId(next.errorNodeId())
                .build();
            db.executions.put(executionId, merged);

            step.logEntries().forEach(db::appendLog);
            if (step.checkpoint() != null) {
                db.checkpoints.computeIfAbsent(executionId, k -> new ArrayList<>()).add(step.checkpoint());
            }
            return merged;
        }
    }

    @Override
    public void release(String executionId, String workerId) {
        synchronized (db.lock()) {
            Execution stored = db.executions.get(executionId);
            if (stored == null || !workerId.equals(stored.leaseOwner())) {
                return;
            }
            db.executions.put(executionId, stored.toBuilder()
                .leaseOwner(null)
                .leaseExpiresAt(null)
                .build());
        }
    }

    @Override
    public Execution requestCancellation(String executionId, String reason) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Execution stored = require(executionId);
            if (stored.isTerminal()) {
                throw new InvalidStateTransitionException(executionId, stored.status(), "cancel");
            }

            if (stored.isLeased(now)) {
                Execution flagged = stored.toBuilder().cancelRequested(true).build();
                db.executions.put(executionId, flagged);
                db.appendLog(ExecutionLogEntry.info(executionId, stored.currentNodeId(),
                    "Cancellation requested" + (reason != null ? ": " + reason : ""), now));
                return flagged;
            }

            Transition transition = ExecutionStateMachine.onCancel(stored, reason, now);
            Execution cancelled = transition.execution().toBuilder()
                .leaseOwner(null)
                .leaseExpiresAt(null)
                .build();
            db.executions.put(executionId, cancelled);
            transition.logEntries().forEach(db::appendLog);
            return cancelled;
        }
    }

    @Override
    public Execution pause(String executionId) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Execution stored = require(executionId);
            if (stored.isTerminal() || stored.isLeased(now)) {
                throw new InvalidStateTransitionException(executionId, stored.status(), "pause");
            }
            Execution paused = ExecutionStateMachine.onPause(stored);
            db.executions.put(executionId, paused);
            db.appendLog(ExecutionLogEntry.info(executionId, stored.currentNodeId(), "Execution paused", now));
            return paused;
        }
    }

    @Override
    public Execution resume(String executionId) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Execution stored = require(executionId);
            if (stored.isLeased(now)) {
                throw new InvalidStateTransitionException(executionId, stored.status(), "resume");
            }
            Execution resumed = ExecutionStateMachine.onResume(stored, now);
            db.executions.put(executionId, resumed);
            db.appendLog(ExecutionLogEntry.info(executionId, stored.currentNodeId(), "Execution resumed", now));
            return resumed;
        }
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        synchronized (db.lock()) {
            return Optional.ofNullable(db.executions.get(executionId));
        }
    }

    @Override
    public List<Execution> query(ExecutionQuery query) {
        synchronized (db.lock()) {
            return db.executions.values().stream()
                .filter(e -> query.workflowId() == null || query.workflowId().equals(e.workflowId()))
                .filter(e -> query.status() == null || query.status() == e.status())
                .sorted(Comparator.comparing(Execution::createdAt).reversed())
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());
        }
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        synchronized (db.lock()) {
            Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
            for (Execution e : db.executions.values()) {
                counts.merge(e.status(), 1L, Long::sum);
            }
            return counts;
        }
    }

    @Override
    public long countActiveLeases(Instant now) {
        synchronized (db.lock()) {
            return db.executions.values().stream().filter(e -> e.isLeased(now)).count();
        }
    }

    @Override
    public void appendLog(ExecutionLogEntry entry) {
        synchronized (db.lock()) {
            db.appendLog(entry);
        }
    }

    @Override
    public List<ExecutionLogEntry> findLogs(LogQuery query) {
        synchronized (db.lock()) {
            return matchingLogs(query)
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());
        }
    }

    @Override
    public long countLogs(LogQuery query) {
        synchronized (db.lock()) {
            return matchingLogs(query).count();
        }
    }

    private Stream<ExecutionLogEntry> matchingLogs(LogQuery query) {
        return db.logs.getOrDefault(query.executionId(), List.of()).stream()
            .filter(l -> query.nodeId() == null || query.nodeId().equals(l.nodeId()))
            .filter(l -> query.level() == null || query.level() == l.level());
    }

    @Override
    public List<ExecutionCheckpoint> findCheckpoints(String executionId) {
        synchronized (db.lock()) {
            return List.copyOf(db.checkpoints.getOrDefault(executionId, List.of()));
        }
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        synchronized (db.lock()) {
            List<String> expired = db.executions.values().stream()
                .filter(e -> e.isTerminal() && e.completedAt() != null && e.completedAt().isBefore(cutoff))
                .map(Execution::executionId)
                .collect(Collectors.toList());
            expired.forEach(db::deleteExecution);
            return expired.size();
        }
    }

    private Execution require(String executionId) {
        Execution stored = db.executions.get(executionId);
        if (stored == null) {
            throw new NotFoundException("Execution", executionId);
        }
        return stored;
    }
}
