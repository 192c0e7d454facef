package com.stepflow.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.ScheduleRepository;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.coordinator.ExecutionCoordinator;
import com.stepflow.engine.execution.ExecutionEngine;
import com.stepflow.engine.history.ExecutionHistoryService;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.service.ExecutionService;
import com.stepflow.engine.service.ScheduleService;
import com.stepflow.engine.service.WorkflowDefinitionService;
import com.stepflow.engine.signal.SignalRouter;
import com.stepflow.scheduler.CronScheduler;
import com.stepflow.scheduler.RetentionSweeper;
import com.stepflow.worker.ActivityHandler;
import com.stepflow.worker.BuiltinActivityHandlers;
import com.stepflow.worker.HandlerRegistryActivityInvoker;
import com.stepflow.worker.WorkerPool;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the engine, services and background loops.
 *
 * Applications contribute node types by declaring {@link ActivityHandler}
 * beans; the bean name is the node type.
 */
@Configuration
public class StepflowConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public HandlerRegistryActivityInvoker activityInvoker(ObjectMapper objectMapper,
                                                          StepflowProperties properties,
                                                          ListableBeanFactory beanFactory) {
        HandlerRegistryActivityInvoker invoker =
            new HandlerRegistryActivityInvoker(objectMapper, properties.nodeTimeout(),
                properties.leaseDuration().dividedBy(3));
        BuiltinActivityHandlers.registerAll(invoker);
        beanFactory.getBeansOfType(ActivityHandler.class).forEach(invoker::register);
        return invoker;
    }

    @Bean
    public ExecutionEngine executionEngine(ExecutionStore store,
                                           SignalRepository signalRepository,
                                           WorkflowDefinitionRepository definitionRepository,
                                           HandlerRegistryActivityInvoker activityInvoker,
                                           ExecutionMetrics metrics,
                                           StepflowProperties properties,
                                           Clock clock) {
        return new ExecutionEngine(store, signalRepository, definitionRepository, activityInvoker,
            metrics, properties, clock);
    }

    @Bean
    public SignalRouter signalRouter(ExecutionStore store, SignalRepository signalRepository,
                                     ExecutionMetrics metrics, Clock clock) {
        return new SignalRouter(store, signalRepository, metrics, clock);
    }

    @Bean
    public ExecutionService executionService(ExecutionStore store,
                                             WorkflowDefinitionRepository definitionRepository,
                                             SignalRouter signalRouter,
                                             ExecutionHistoryService historyService,
                                             ExecutionMetrics metrics,
                                             Clock clock) {
        return new ExecutionCoordinator(store, definitionRepository, signalRouter, historyService, metrics, clock);
    }

    @Bean
    public ScheduleService scheduleService(ScheduleRepository scheduleRepository,
                                           WorkflowDefinitionRepository definitionRepository,
                                           Clock clock) {
        return new ScheduleService(scheduleRepository, definitionRepository, clock);
    }

    @Bean
    public WorkflowDefinitionService workflowDefinitionService(WorkflowDefinitionRepository definitionRepository,
                                                               ScheduleRepository scheduleRepository,
                                                               ScheduleService scheduleService,
                                                               Clock clock) {
        return new WorkflowDefinitionService(definitionRepository, scheduleRepository, scheduleService, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "stepflow.worker-enabled", havingValue = "true", matchIfMissing = true)
    public WorkerPool workerPool(ExecutionStore store, ExecutionEngine engine, ExecutionMetrics metrics,
                                 StepflowProperties properties) {
        return new WorkerPool(store, engine, metrics, properties);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "stepflow.scheduler-enabled", havingValue = "true", matchIfMissing = true)
    public CronScheduler cronScheduler(ScheduleRepository scheduleRepository,
                                       WorkflowDefinitionRepository definitionRepository,
                                       ExecutionMetrics metrics,
                                       StepflowProperties properties,
                                       Clock clock) {
        return new CronScheduler(scheduleRepository, definitionRepository, metrics, clock,
            properties.schedulerPollInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "stepflow.scheduler-enabled", havingValue = "true", matchIfMissing = true)
    public RetentionSweeper retentionSweeper(ExecutionStore store, ExecutionMetrics metrics,
                                             StepflowProperties properties, Clock clock) {
        return new RetentionSweeper(store, metrics, clock, properties.historyRetentionWindow(),
            properties.retentionSweepInterval());
    }
}
