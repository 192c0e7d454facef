package com.stepflow.engine.execution;

import com.stepflow.core.activity.ActivityInvoker;
import com.stepflow.core.activity.ActivityRequest;
import com.stepflow.core.exception.LeaseLostException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.NodeDefinition;
import com.stepflow.core.model.NodeOutcome;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.StepResult;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.core.statemachine.ExecutionStateMachine;
import com.stepflow.core.statemachine.Transition;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.logging.LoggingContext;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a leased execution through its graph, one node per tick.
 *
 * Each tick renews the lease, honors a pending cancellation, consumes an
 * awaited signal, invokes the current node and persists the resulting
 * transition in a single store write. A tick whose lease was lost writes
 * nothing: the store rejects it and the tick is abandoned.
 *
 * Thread-safe: holds no per-execution state, so worker threads share one instance.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String CANCEL_REASON = "Cancellation requested";

    private final ExecutionStore store;
    private final SignalRepository signalRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final ActivityInvoker invoker;
    private final ExecutionMetrics metrics;
    private final StepflowProperties properties;
    private final Clock clock;
    private final Map<String, WorkflowDefinition> definitionCache = new ConcurrentHashMap<>();

    public ExecutionEngine(
            ExecutionStore store,
            SignalRepository signalRepository,
            WorkflowDefinitionRepository definitionRepository,
            ActivityInvoker invoker,
            ExecutionMetrics metrics,
            StepflowProperties properties,
            Clock clock) {
        this.store = store;
        this.signalRepository = signalRepository;
        this.definitionRepository = definitionRepository;
        this.invoker = invoker;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Step a claimed execution until it leaves RUNNING or the per-tick time
     * budget is spent, then release the lease.
     *
     * @param claimed execution leased to {@code workerId}
     * @param workerId lease holder
     * @return the last known state of the execution
     */
    public Execution run(Execution claimed, String workerId) {
        Instant deadline = clock.instant().plus(properties.perTickTimeBudget());
        Execution current = claimed;

        try (LoggingContext ctx = LoggingContext.forExecution(
                claimed.executionId(), claimed.workflowId(), claimed.currentNodeId(), claimed.retryCount())) {
            do {
                current = tick(current.executionId(), workerId);
            } while (current.status() == ExecutionStatus.RUNNING && clock.instant().isBefore(deadline));

            if (current.status() == ExecutionStatus.RUNNING) {
                log.debug("Time budget spent on {}, releasing", current.executionId());
            }
        } catch (LeaseLostException e) {
            metrics.leaseLost();
            log.info("Lease on {} lost by worker {}, abandoning tick", claimed.executionId(), workerId);
        } finally {
            store.release(claimed.executionId(), workerId);
        }
        return current;
    }

    /**
     * Perform one step of an execution leased to {@code workerId}.
     *
     * @return the execution as persisted after the step, or as found if nothing could be done
     * @throws LeaseLostException if the worker no longer holds the lease
     */
    public Execution tick(String executionId, String workerId) {
        Execution current = store.renewLease(executionId, workerId, properties.leaseDuration());
        Instant now = clock.instant();

        if (current.isTerminal()) {
            return current;
        }

        if (current.cancelRequested()) {
            Transition cancelled = ExecutionStateMachine.onCancel(current, CANCEL_REASON, now);
            Execution persisted = store.persistStep(executionId, workerId, cancelled.toStepResult());
            metrics.executionFinished(persisted.workflowId(), persisted.status());
            log.info("Execution {} cancelled", executionId);
            return persisted;
        }

        if (current.status() == ExecutionStatus.WAITING_SIGNAL) {
            Optional<Execution> resumed = consumeSignal(current, workerId);
            if (resumed.isEmpty()) {
                return current;
            }
            current = resumed.get();
        }

        List<ExecutionLogEntry> preamble = new ArrayList<>();
        if (current.status() == ExecutionStatus.PENDING || current.status() == ExecutionStatus.PAUSED) {
            if (current.status() == ExecutionStatus.PAUSED
                    && (current.nextRetryAt() == null || current.nextRetryAt().isAfter(now))) {
                return current;
            }
            if (current.status() == ExecutionStatus.PENDING) {
                preamble.add(ExecutionLogEntry.info(executionId, current.currentNodeId(), "Execution started", now));
            }
            current = ExecutionStateMachine.onClaim(current, now);
        }

        return step(current, workerId, preamble);
    }

    private Optional<Execution> consumeSignal(Execution waiting, String workerId) {
        Optional<Signal> signal = signalRepository.findOldestUnprocessed(
            waiting.executionId(), waiting.awaitingSignalType());
        if (signal.isEmpty()) {
            return Optional.empty();
        }
        Optional<Execution> resumed = signalRepository.resumeWithSignal(signal.get().signalId(), workerId);
        resumed.ifPresent(e -> log.info("Execution {} resumed by signal {}",
            e.executionId(), signal.get().signalType()));
        return resumed;
    }

    private Execution step(Execution running, String workerId, List<ExecutionLogEntry> preamble) {
        String executionId = running.executionId();
        LoggingContext.setNodeId(running.currentNodeId());

        Optional<WorkflowDefinition> found = definition(running.workflowId(), running.workflowVersion());
        NodeOutcome outcome;
        WorkflowDefinition definition;
        if (found.isEmpty()) {
            definition = WorkflowDefinition.builder()
                .workflowId(running.workflowId())
                .version(running.workflowVersion())
                .createdAt(clock.instant())
                .build();
            outcome = NodeOutcome.fatal("DEFINITION_NOT_FOUND",
                "Workflow " + running.workflowId() + " version " + running.workflowVersion() + " not found");
        } else {
            definition = found.get();
            outcome = invoke(running, definition, workerId);
        }

        Transition transition = ExecutionStateMachine.transition(
            running, outcome, definition,
            definition.effectiveRetryPolicy(properties.defaultRetryPolicy()),
            clock.instant());

        List<ExecutionLogEntry> logs = new ArrayList<>(preamble);
        logs.addAll(transition.logEntries());
        Execution persisted = store.persistStep(executionId, workerId,
            new StepResult(transition.execution(), logs, transition.checkpoint()));

        recordOutcome(persisted, running.currentNodeId());
        return persisted;
    }

    private NodeOutcome invoke(Execution running, WorkflowDefinition definition, String workerId) {
        String nodeId = running.currentNodeId();
        Optional<NodeDefinition> node = definition.getNode(nodeId);
        if (node.isEmpty()) {
            return NodeOutcome.fatal("UNKNOWN_NODE", "Node " + nodeId + " is not part of " + definition.id());
        }

        ActivityRequest request = new ActivityRequest(
            running.executionId(),
            running.workflowId(),
            running.workflowVersion(),
            node.get(),
            running.stateBlob(),
            running.retryCount(),
            running.stepCount(),
            () -> heartbeat(running.executionId(), workerId)
        );

        log.debug("Invoking node {} of type {}", nodeId, node.get().type());
        long startNanos = System.nanoTime();
        NodeOutcome outcome;
        try {
            outcome = invoker.invoke(request);
            if (outcome == null) {
                outcome = NodeOutcome.fatal("NO_OUTCOME", "Node " + nodeId + " returned no outcome");
            }
        } catch (RuntimeException e) {
            log.warn("Node {} threw {}", nodeId, e.toString());
            outcome = NodeOutcome.retryable("ACTIVITY_ERROR", e.getMessage());
        }
        metrics.nodeInvoked(running.workflowId(), node.get().type(), outcome.status().name(),
            Duration.ofNanos(System.nanoTime() - startNanos));
        return outcome;
    }

    private boolean heartbeat(String executionId, String workerId) {
        try {
            store.renewLease(executionId, workerId, properties.leaseDuration());
            return true;
        } catch (LeaseLostException e) {
            return false;
        }
    }

    private void recordOutcome(Execution persisted, String nodeId) {
        switch (persisted.status()) {
            case PAUSED -> {
                metrics.retryScheduled(persisted.workflowId(), nodeId);
                log.warn("Node {} failed, retry {} scheduled at {}",
                    nodeId, persisted.retryCount(), persisted.nextRetryAt());
            }
            case COMPLETED -> {
                metrics.executionFinished(persisted.workflowId(), persisted.status());
                log.info("Execution {} completed", persisted.executionId());
            }
            case FAILED -> {
                metrics.executionFinished(persisted.workflowId(), persisted.status());
                log.error("Execution {} failed at node {}: {}",
                    persisted.executionId(), persisted.errorNodeId(), persisted.error());
            }
            case WAITING_SIGNAL -> log.info("Execution {} waiting for signal {}",
                persisted.executionId(), persisted.awaitingSignalType());
            default -> log.debug("Node {} completed", nodeId);
        }
    }

    private Optional<WorkflowDefinition> definition(String workflowId, int version) {
        String key = workflowId + ":" + version;
        WorkflowDefinition cached = definitionCache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<WorkflowDefinition> loaded = definitionRepository.find(workflowId, version);
        loaded.ifPresent(d -> definitionCache.put(key, d));
        return loaded;
    }
}
