package com.stepflow.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.test.InMemoryStepflow;
import com.stepflow.engine.test.ScriptedInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class WorkerPoolTest {

    private InMemoryStepflow stepflow;
    private ScriptedInvoker invoker;
    private WorkflowDefinition definition;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        stepflow = new InMemoryStepflow().withProperties(new StepflowProperties(
            3, Duration.ofSeconds(1), 2.0, Duration.ofHours(1),
            Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofMinutes(5),
            3, Duration.ofMillis(10), Duration.ofSeconds(5),
            Duration.ofDays(30), Duration.ofHours(1),
            "memory", true, true));
        invoker = new ScriptedInvoker();
        definition = stepflow.register(TestWorkflows.linear("etl", "extract", "transform", "load"));
        pool = new WorkerPool("pool", stepflow.store, stepflow.engine(invoker), stepflow.metrics,
            stepflow.properties());
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    @DisplayName("pollOnce claims and runs one execution, or returns empty when idle")
    void pollOnce() {
        assertThat(pool.pollOnce(pool.workerId(0))).isEmpty();

        Execution execution = stepflow.store.createExecution(definition, null);
        Optional<Execution> result = pool.pollOnce(pool.workerId(0));

        assertThat(result).map(Execution::executionId).contains(execution.executionId());
        assertThat(result.get().status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(stepflow.meterRegistry.counter(ExecutionMetrics.CLAIMS).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An execution leased by a crashed worker is recovered after the lease expires")
    void crashRecoveryAfterLeaseExpiry() {
        Execution execution = stepflow.store.createExecution(definition, null);
        stepflow.store.claim("crashed-worker", stepflow.properties().leaseDuration()).orElseThrow();

        assertThat(pool.pollOnce(pool.workerId(0))).isEmpty();

        stepflow.clock.advance(stepflow.properties().leaseDuration());
        Optional<Execution> recovered = pool.pollOnce(pool.workerId(1));

        assertThat(recovered).isPresent();
        assertThat(recovered.get().status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(invoker.invokedNodes()).containsExactly("extract", "transform", "load");
        assertThat(stepflow.store.findById(execution.executionId()).orElseThrow().leaseOwner()).isNull();
    }

    @Test
    @DisplayName("Started pool drains the queue and stops cleanly")
    void startAndStop() {
        for (int i = 0; i < 20; i++) {
            stepflow.store.createExecution(definition, null);
        }

        pool.start();
        assertThat(pool.isRunning()).isTrue();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
            assertThat(stepflow.store.query(new ExecutionQuery(null, ExecutionStatus.COMPLETED, 100, 0)))
                .hasSize(20));
        await().atMost(Duration.ofSeconds(5)).until(() -> pool.activeWorkers() == 3);

        pool.stop();

        assertThat(pool.isRunning()).isFalse();
        assertThat(pool.activeWorkers()).isZero();
        assertThat(invoker.invocationsOf("load")).isEqualTo(20);
    }

    @Test
    @DisplayName("A handler running past the lease duration keeps its lease through heartbeats")
    void longRunningNodeRenewsLease() {
        HandlerRegistryActivityInvoker realInvoker =
            new HandlerRegistryActivityInvoker(new ObjectMapper(), Duration.ofSeconds(30), Duration.ofMillis(20));
        AtomicInteger invocations = new AtomicInteger();
        realInvoker.register(TestWorkflows.NODE_TYPE, ctx -> {
            invocations.incrementAndGet();
            // 40s of simulated work against a 30s lease
            for (int i = 0; i < 4; i++) {
                Instant before = leaseExpiry(ctx.getExecutionId());
                stepflow.clock.advance(Duration.ofSeconds(10));
                await().atMost(Duration.ofSeconds(5))
                    .until(() -> leaseExpiry(ctx.getExecutionId()).isAfter(before));
            }
            return ctx.toJsonNode(Map.of("crunched", true));
        });
        WorkflowDefinition longRunning = stepflow.register(TestWorkflows.linear("batch", "crunch"));
        WorkerPool realPool = new WorkerPool("real", stepflow.store, stepflow.engine(realInvoker), stepflow.metrics,
            stepflow.properties());
        Execution execution = stepflow.store.createExecution(longRunning, null);

        try {
            Optional<Execution> result = realPool.pollOnce(realPool.workerId(0));

            assertThat(result).map(Execution::status).contains(ExecutionStatus.COMPLETED);
            assertThat(invocations.get()).isEqualTo(1);
            assertThat(stepflow.store.findById(execution.executionId()).orElseThrow().retryCount()).isZero();
        } finally {
            realInvoker.shutdown();
        }
    }

    private Instant leaseExpiry(String executionId) {
        return stepflow.store.findById(executionId).orElseThrow().leaseExpiresAt();
    }

    @Test
    @DisplayName("Worker ids combine the pool id and the worker index")
    void workerIds() {
        assertThat(pool.workerId(2)).isEqualTo("pool-2");
    }
}
