package com.stepflow.engine.metrics;

import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.repository.ExecutionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for executions, leases, signals and schedules.
 *
 * Metrics exposed:
 * - Executions by status (gauge, refreshed via {@link #refreshStatusCounts()})
 * - Lifecycle counters: created, completed, failed, cancelled
 * - Node invocation latency by node type and outcome
 * - Retry, claim, lease-loss, signal and schedule counters
 */
public class ExecutionMetrics implements MeterBinder {

    public static final String EXECUTIONS = "stepflow.executions";
    public static final String EXECUTIONS_CREATED = "stepflow.executions.created";
    public static final String EXECUTIONS_FINISHED = "stepflow.executions.finished";
    public static final String NODE_DURATION = "stepflow.node.duration";
    public static final String RETRIES = "stepflow.retries.scheduled";
    public static final String CLAIMS = "stepflow.lease.claims";
    public static final String LEASES_LOST = "stepflow.lease.lost";
    public static final String SIGNALS = "stepflow.signals";
    public static final String SCHEDULES_FIRED = "stepflow.schedules.fired";
    public static final String RETENTION_DELETED = "stepflow.retention.deleted";

    private final MeterRegistry registry;
    private final ExecutionStore store;
    private final AtomicReference<Map<ExecutionStatus, Long>> statusCounts = new AtomicReference<>(Map.of());

    public ExecutionMetrics(MeterRegistry registry, ExecutionStore store) {
        this.registry = registry;
        this.store = store;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            Gauge.builder(EXECUTIONS, statusCounts, counts -> counts.get().getOrDefault(status, 0L))
                .tag("status", status.name())
                .description("Number of executions in " + status + " status")
                .register(registry);
        }
    }

    /**
     * Reload the status gauges from the store.
     */
    public void refreshStatusCounts() {
        statusCounts.set(Map.copyOf(store.countByStatus()));
    }

    // ========== Execution lifecycle ==========

    public void executionCreated(String workflowId, String origin) {
        Counter.builder(EXECUTIONS_CREATED)
            .tag("workflow", workflowId)
            .tag("origin", origin)
            .description("Total executions created")
            .register(registry)
            .increment();
    }

    public void executionFinished(String workflowId, ExecutionStatus status) {
        Counter.builder(EXECUTIONS_FINISHED)
            .tag("workflow", workflowId)
            .tag("status", status.name())
            .description("Total executions reaching a terminal status")
            .register(registry)
            .increment();
    }

    // ========== Nodes ==========

    public void nodeInvoked(String workflowId, String nodeType, String outcome, Duration duration) {
        Timer.builder(NODE_DURATION)
            .tag("workflow", workflowId)
            .tag("type", nodeType)
            .tag("outcome", outcome)
            .description("Node invocation duration")
            .register(registry)
            .record(duration);
    }

    public void retryScheduled(String workflowId, String nodeId) {
        Counter.builder(RETRIES)
            .tag("workflow", workflowId)
            .tag("node", nodeId)
            .description("Total retries scheduled after retryable failures")
            .register(registry)
            .increment();
    }

    // ========== Leases ==========

    public void executionClaimed() {
        Counter.builder(CLAIMS)
            .description("Total successful claims")
            .register(registry)
            .increment();
    }

    public void leaseLost() {
        Counter.builder(LEASES_LOST)
            .description("Total writes rejected because the lease was lost")
            .register(registry)
            .increment();
    }

    // ========== Signals and schedules ==========

    public void signalReceived(String signalType, boolean resumedImmediately) {
        Counter.builder(SIGNALS)
            .tag("type", signalType)
            .tag("resumed", String.valueOf(resumedImmediately))
            .description("Total signals received")
            .register(registry)
            .increment();
    }

    public void scheduleFired(String workflowId, boolean triggered) {
        Counter.builder(SCHEDULES_FIRED)
            .tag("workflow", workflowId)
            .tag("triggered", String.valueOf(triggered))
            .description("Total schedule occurrences processed")
            .register(registry)
            .increment();
    }

    public void retentionDeleted(int count) {
        Counter.builder(RETENTION_DELETED)
            .description("Total terminal executions removed by the retention sweep")
            .register(registry)
            .increment(count);
    }
}
