package com.stepflow.engine.test;

import com.stepflow.core.activity.ActivityInvoker;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.test.MutableClock;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.coordinator.ExecutionCoordinator;
import com.stepflow.engine.execution.ExecutionEngine;
import com.stepflow.engine.history.ExecutionHistoryService;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.persistence.InMemoryDatabase;
import com.stepflow.engine.persistence.InMemoryExecutionStore;
import com.stepflow.engine.persistence.InMemoryScheduleRepository;
import com.stepflow.engine.persistence.InMemorySignalRepository;
import com.stepflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.stepflow.engine.service.ScheduleService;
import com.stepflow.engine.service.WorkflowDefinitionService;
import com.stepflow.engine.signal.SignalRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * In-memory wiring of the store, repositories and services around a {@link MutableClock}.
 */
public class InMemoryStepflow {

    public final MutableClock clock = new MutableClock();
    public final InMemoryDatabase db = new InMemoryDatabase();
    public final InMemoryExecutionStore store = new InMemoryExecutionStore(db, clock);
    public final InMemorySignalRepository signals = new InMemorySignalRepository(db, clock);
    public final InMemoryScheduleRepository schedules = new InMemoryScheduleRepository(db);
    public final InMemoryWorkflowDefinitionRepository definitions = new InMemoryWorkflowDefinitionRepository(db);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ExecutionMetrics metrics = new ExecutionMetrics(meterRegistry, store);

    private StepflowProperties properties = StepflowProperties.defaults();

    public StepflowProperties properties() {
        return properties;
    }

    public InMemoryStepflow withProperties(StepflowProperties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * Store a definition as-is (no version assignment).
     */
    public WorkflowDefinition register(WorkflowDefinition definition) {
        definitions.save(definition);
        return definition;
    }

    public ExecutionEngine engine(ActivityInvoker invoker) {
        return new ExecutionEngine(store, signals, definitions, invoker, metrics, properties, clock);
    }

    public SignalRouter signalRouter() {
        return new SignalRouter(store, signals, metrics, clock);
    }

    public ExecutionHistoryService historyService() {
        return new ExecutionHistoryService(store, signals, definitions, metrics, clock);
    }

    public ExecutionCoordinator coordinator() {
        return new ExecutionCoordinator(store, definitions, signalRouter(), historyService(), metrics, clock);
    }

    public ScheduleService scheduleService() {
        return new ScheduleService(schedules, definitions, clock);
    }

    public WorkflowDefinitionService definitionService() {
        return new WorkflowDefinitionService(definitions, schedules, scheduleService(), clock);
    }
}
