package com.stepflow.core.model;

/**
 * How a workflow may be started besides the manual trigger API.
 *
 * @param cronExpression five-field cron expression, null when not time-triggered
 * @param webhookPath path suffix accepted by the webhook trigger, null when absent
 */
public record TriggerConfig(
    String cronExpression,
    String webhookPath
) {
    public static TriggerConfig manual() {
        return new TriggerConfig(null, null);
    }

    public static TriggerConfig cron(String cronExpression) {
        return new TriggerConfig(cronExpression, null);
    }

    public boolean hasCron() {
        return cronExpression != null && !cronExpression.isBlank();
    }
}
