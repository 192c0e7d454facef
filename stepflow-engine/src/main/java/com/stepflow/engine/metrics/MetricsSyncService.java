package com.stepflow.engine.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically syncs the status gauges from store state.
 * Keeps gauges accurate after restarts and across cluster nodes.
 */
@Component
public class MetricsSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncService.class);

    private final ExecutionMetrics executionMetrics;

    public MetricsSyncService(ExecutionMetrics executionMetrics) {
        this.executionMetrics = executionMetrics;
    }

    @Scheduled(fixedRate = 30000, initialDelay = 5000)
    public void syncStatusGauges() {
        try {
            executionMetrics.refreshStatusCounts();
            log.debug("Synced execution status gauges");
        } catch (Exception e) {
            log.warn("Failed to sync execution status gauges: {}", e.getMessage());
        }
    }
}
