package com.stepflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Recurring cron trigger of a workflow.
 * nextRunAt is advanced with a compare-and-set so each occurrence fires at most once.
 */
public record Schedule(
    String scheduleId,
    String workflowId,
    String cronExpression,
    boolean active,
    Instant nextRunAt,
    Instant lastRunAt,
    Instant createdAt
) {
    public static Schedule create(String workflowId, String cronExpression, Instant nextRunAt, Instant now) {
        return new Schedule(
            UUID.randomUUID().toString(),
            workflowId,
            cronExpression,
            true,
            nextRunAt,
            null,
            now
        );
    }

    public Schedule withActive(boolean active) {
        return new Schedule(scheduleId, workflowId, cronExpression, active, nextRunAt, lastRunAt, createdAt);
    }

    public Schedule withNextRunAt(Instant nextRunAt) {
        return new Schedule(scheduleId, workflowId, cronExpression, active, nextRunAt, lastRunAt, createdAt);
    }
}
