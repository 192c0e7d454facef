package com.stepflow.engine.config;

import com.stepflow.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Runtime configuration, bound from the {@code stepflow.*} namespace.
 *
 * @param maxRetries retry budget per execution
 * @param baseDelay delay before the first retry
 * @param backoffMultiplier growth factor of successive retry delays
 * @param maxDelayCap upper bound of a single retry delay
 * @param leaseDuration lease granted on claim and on every renewal
 * @param perTickTimeBudget how long a worker may keep stepping one execution before releasing it
 * @param nodeTimeout default timeout of a single node invocation
 * @param workerPoolSize number of concurrent worker loops
 * @param workerPollInterval sleep between claims when nothing is eligible
 * @param schedulerPollInterval interval between scans for due schedules
 * @param historyRetentionWindow age after which terminal executions are deleted
 * @param retentionSweepInterval interval between retention sweeps
 * @param storeType {@code jdbc} or {@code memory}
 * @param workerEnabled whether this process runs the worker pool
 * @param schedulerEnabled whether this process runs the cron scheduler and retention sweeper
 */
@ConfigurationProperties(prefix = "stepflow")
public record StepflowProperties(
    @DefaultValue("3") int maxRetries,
    @DefaultValue("1s") Duration baseDelay,
    @DefaultValue("2.0") double backoffMultiplier,
    @DefaultValue("1h") Duration maxDelayCap,
    @DefaultValue("30s") Duration leaseDuration,
    @DefaultValue("60s") Duration perTickTimeBudget,
    @DefaultValue("5m") Duration nodeTimeout,
    @DefaultValue("10") int workerPoolSize,
    @DefaultValue("500ms") Duration workerPollInterval,
    @DefaultValue("5s") Duration schedulerPollInterval,
    @DefaultValue("30d") Duration historyRetentionWindow,
    @DefaultValue("1h") Duration retentionSweepInterval,
    @DefaultValue("jdbc") String storeType,
    @DefaultValue("true") boolean workerEnabled,
    @DefaultValue("true") boolean schedulerEnabled
) {
    /**
     * Defaults, for use outside a Spring context.
     */
    public static StepflowProperties defaults() {
        return new StepflowProperties(
            3, Duration.ofSeconds(1), 2.0, Duration.ofHours(1),
            Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofMinutes(5),
            10, Duration.ofMillis(500), Duration.ofSeconds(5),
            Duration.ofDays(30), Duration.ofHours(1),
            "jdbc", true, true
        );
    }

    /**
     * Engine-wide retry policy; workflows may override it.
     */
    public RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(maxRetries, baseDelay, backoffMultiplier, maxDelayCap);
    }

    public StepflowProperties withRetry(int maxRetries, Duration baseDelay) {
        return new StepflowProperties(maxRetries, baseDelay, backoffMultiplier, maxDelayCap,
            leaseDuration, perTickTimeBudget, nodeTimeout, workerPoolSize, workerPollInterval,
            schedulerPollInterval, historyRetentionWindow, retentionSweepInterval,
            storeType, workerEnabled, schedulerEnabled);
    }

    public StepflowProperties withLeaseDuration(Duration leaseDuration) {
        return new StepflowProperties(maxRetries, baseDelay, backoffMultiplier, maxDelayCap,
            leaseDuration, perTickTimeBudget, nodeTimeout, workerPoolSize, workerPollInterval,
            schedulerPollInterval, historyRetentionWindow, retentionSweepInterval,
            storeType, workerEnabled, schedulerEnabled);
    }
}
