package com.stepflow.engine.health;

import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.repository.ExecutionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the execution store.
 * Reports health status based on:
 * - Store reachability
 * - Executions by status
 * - Active leases
 */
@Component
public class StepflowHealthIndicator implements HealthIndicator {

    private final ExecutionStore store;
    private final Clock clock;

    public StepflowHealthIndicator(ExecutionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        try {
            Map<ExecutionStatus, Long> counts = store.countByStatus();
            details.put("store", "reachable");
            details.put("executions", counts);

            long active = store.countActiveLeases(clock.instant());
            long running = counts.getOrDefault(ExecutionStatus.RUNNING, 0L);
            details.put("activeLeases", active);

            // RUNNING rows without a live lease are waiting for a worker to reclaim them
            if (running > active) {
                details.put("unleasedRunning", running - active);
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            details.put("store", "unreachable");
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
