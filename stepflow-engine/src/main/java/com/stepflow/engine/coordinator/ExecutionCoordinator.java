package com.stepflow.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowInactiveException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.engine.history.ExecutionHistoryService;
import com.stepflow.engine.history.ExecutionSummary;
import com.stepflow.engine.history.LogPage;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.service.ExecutionService;
import com.stepflow.engine.signal.SignalRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Control plane entry point for executions.
 *
 * Triggers create PENDING executions that workers pick up; cancel, pause and
 * resume go straight to the store, which arbitrates against leased workers.
 */
public class ExecutionCoordinator implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final ExecutionStore store;
    private final WorkflowDefinitionRepository definitionRepository;
    private final SignalRouter signalRouter;
    private final ExecutionHistoryService historyService;
    private final ExecutionMetrics metrics;
    private final Clock clock;

    public ExecutionCoordinator(
            ExecutionStore store,
            WorkflowDefinitionRepository definitionRepository,
            SignalRouter signalRouter,
            ExecutionHistoryService historyService,
            ExecutionMetrics metrics,
            Clock clock) {
        this.store = store;
        this.definitionRepository = definitionRepository;
        this.signalRouter = signalRouter;
        this.historyService = historyService;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Execution trigger(String workflowId, JsonNode payload) {
        WorkflowDefinition definition = definitionRepository.findLatest(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        return start(definition, payload, "manual");
    }

    @Override
    public Execution triggerWebhook(String webhookPath, JsonNode payload) {
        WorkflowDefinition definition = definitionRepository.listLatest().stream()
            .filter(WorkflowDefinition::active)
            .filter(d -> webhookPath.equals(d.triggerConfig().webhookPath()))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Webhook", webhookPath));
        return start(definition, payload, "webhook");
    }

    private Execution start(WorkflowDefinition definition, JsonNode payload, String origin) {
        if (!definition.active()) {
            throw new WorkflowInactiveException(definition.workflowId());
        }
        Instant now = clock.instant();
        Execution execution = Execution.create(definition, payload, now);
        store.createExecution(execution, List.of(ExecutionLogEntry.info(execution.executionId(),
            execution.currentNodeId(), "Execution created by " + origin + " trigger on version "
                + definition.version(), now)));
        metrics.executionCreated(definition.workflowId(), origin);

        log.info("Created execution {} of {} ({} trigger)", execution.executionId(), definition.id(), origin);
        return execution;
    }

    @Override
    public Execution cancel(String executionId, String reason) {
        Execution execution = store.requestCancellation(executionId, reason);
        if (execution.isTerminal()) {
            metrics.executionFinished(execution.workflowId(), execution.status());
            log.info("Cancelled execution {}", executionId);
        } else {
            log.info("Cancellation of leased execution {} requested", executionId);
        }
        return execution;
    }

    @Override
    public Execution pause(String executionId) {
        Execution paused = store.pause(executionId);
        log.info("Paused execution {}", executionId);
        return paused;
    }

    @Override
    public Execution resume(String executionId) {
        Execution resumed = store.resume(executionId);
        log.info("Resumed execution {}", executionId);
        return resumed;
    }

    @Override
    public Execution replay(String executionId, String fromNodeId) {
        return historyService.replay(executionId, fromNodeId);
    }

    @Override
    public SignalRouter.Delivery sendSignal(String executionId, String signalType, JsonNode payload) {
        return signalRouter.deliver(executionId, signalType, payload);
    }

    @Override
    public Execution getExecution(String executionId) {
        return store.findById(executionId)
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    @Override
    public List<Execution> queryExecutions(ExecutionQuery query) {
        return store.query(query);
    }

    @Override
    public LogPage getLogs(LogQuery query) {
        return historyService.getLogs(query);
    }

    @Override
    public List<ExecutionCheckpoint> getCheckpoints(String executionId) {
        return historyService.getCheckpoints(executionId);
    }

    @Override
    public List<Signal> getSignals(String executionId) {
        return historyService.getSignals(executionId);
    }

    @Override
    public ExecutionSummary getSummary(String executionId) {
        return historyService.getSummary(executionId);
    }
}
