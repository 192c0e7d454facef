package com.stepflow.engine.persistence;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.Signal;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.statemachine.ExecutionStateMachine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SignalRepository.
 * For demonstration and testing purposes.
 */
@Repository
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "memory")
public class InMemorySignalRepository implements SignalRepository {

    private final InMemoryDatabase db;
    private final Clock clock;

    public InMemorySignalRepository(InMemoryDatabase db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Signal record(Signal signal) {
        synchronized (db.lock()) {
            db.signals.put(signal.signalId(), signal);
            return signal;
        }
    }

    @Override
    public Optional<Signal> findById(String signalId) {
        synchronized (db.lock()) {
            return Optional.ofNullable(db.signals.get(signalId));
        }
    }

    @Override
    public List<Signal> findByExecution(String executionId) {
        synchronized (db.lock()) {
            return db.signals.values().stream()
                .filter(s -> s.executionId().equals(executionId))
                .collect(Collectors.toList());
        }
    }

    @Override
    public Optional<Signal> findOldestUnprocessed(String executionId, String signalType) {
        synchronized (db.lock()) {
            return db.signals.values().stream()
                .filter(s -> !s.processed()
                    && s.executionId().equals(executionId)
                    && s.signalType().equals(signalType))
                .findFirst();
        }
    }

    @Override
    public Optional<Execution> resumeWithSignal(String signalId, String workerId) {
        synchronized (db.lock()) {
            Instant now = clock.instant();
            Signal signal = db.signals.get(signalId);
            if (signal == null || signal.processed()) {
                return Optional.empty();
            }
            Execution execution = db.executions.get(signal.executionId());
            if (execution == null
                    || execution.status() != ExecutionStatus.WAITING_SIGNAL
                    || !signal.signalType().equals(execution.awaitingSignalType())) {
                return Optional.empty();
            }
            if (execution.isLeased(now) && !execution.isLeasedBy(workerId, now)) {
                return Optional.empty();
            }

            Execution resumed = ExecutionStateMachine.onSignal(execution, signal, now);
            db.executions.put(resumed.executionId(), resumed);
            db.signals.put(signalId, signal.markProcessed(now));
            db.appendLog(ExecutionLogEntry.info(resumed.executionId(), resumed.currentNodeId(),
                "Resumed by signal " + signal.signalType(), now));
            return Optional.of(resumed);
        }
    }
}
