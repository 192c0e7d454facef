package com.stepflow.core.model;

import java.time.Instant;

/**
 * Outcome of a retry evaluation: retry at a given instant, or fail.
 */
public record RetryDecision(
    boolean retry,
    Instant retryAt
) {
    private static final RetryDecision FAIL = new RetryDecision(false, null);

    public static RetryDecision retryAt(Instant retryAt) {
        return new RetryDecision(true, retryAt);
    }

    public static RetryDecision fail() {
        return FAIL;
    }
}
