package com.stepflow.scheduler;

import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes terminal executions, with their logs, checkpoints and
 * signals, once they are older than the retention window.
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final ExecutionStore store;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final Duration retentionWindow;
    private final Duration sweepInterval;

    private ScheduledExecutorService scheduler;

    public RetentionSweeper(ExecutionStore store, ExecutionMetrics metrics, Clock clock,
                            Duration retentionWindow, Duration sweepInterval) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.retentionWindow = retentionWindow;
        this.sweepInterval = sweepInterval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "stepflow-retention"));
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                sweepOnce();
            } catch (Exception e) {
                log.error("Retention sweep failed", e);
            }
        }, sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Retention sweeper started: window {}, interval {}", retentionWindow, sweepInterval);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Delete terminal executions that completed before now minus the retention window.
     *
     * @return number of executions deleted
     */
    public int sweepOnce() {
        Instant cutoff = clock.instant().minus(retentionWindow);
        int deleted = store.deleteTerminalBefore(cutoff);
        if (deleted > 0) {
            metrics.retentionDeleted(deleted);
            log.info("Deleted {} execution(s) completed before {}", deleted, cutoff);
        }
        return deleted;
    }
}
