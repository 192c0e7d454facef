package com.stepflow.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Configuration for retry behavior of failed nodes.
 * Immutable and reusable across workflow definitions.
 *
 * The retry count is tracked per execution, not per node, and is never reset.
 * Backoff carries no jitter so successive retry instants of one execution
 * are monotonically non-decreasing.
 *
 * Invariants:
 * - maxRetries >= 0
 * - baseDelay >= 0
 * - maxDelay >= baseDelay
 * - backoffMultiplier >= 1.0
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    double backoffMultiplier,
    Duration maxDelay
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    /**
     * Default retry policy: 3 retries, delay doubling from 1s, capped at one hour.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofHours(1));
    }

    /**
     * No retry policy: the first retryable failure fails the execution.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Decide what happens after a failure.
     *
     * @param retryCount retries already consumed by the execution
     * @param maxRetries retry budget
     * @param backoffMultiplier growth factor per retry
     * @param baseDelay delay before the first retry
     * @param maxDelay upper bound of any single delay
     * @param errorClass classification of the failure
     * @param now evaluation instant
     * @return RETRY at {@code now + min(baseDelay * multiplier^retryCount, maxDelay)}, or FAIL
     */
    public static RetryDecision decide(int retryCount, int maxRetries, double backoffMultiplier,
                                       Duration baseDelay, Duration maxDelay,
                                       ErrorClass errorClass, Instant now) {
        if (errorClass == ErrorClass.FATAL) {
            return RetryDecision.fail();
        }
        if (retryCount >= maxRetries) {
            return RetryDecision.fail();
        }
        return RetryDecision.retryAt(now.plus(delay(retryCount, backoffMultiplier, baseDelay, maxDelay)));
    }

    /**
     * Decide using this policy's parameters.
     */
    public RetryDecision decide(int retryCount, ErrorClass errorClass, Instant now) {
        return decide(retryCount, maxRetries, backoffMultiplier, baseDelay, maxDelay, errorClass, now);
    }

    /**
     * Compute the delay before the retry following {@code retryCount} earlier retries.
     *
     * @param retryCount 0-indexed number of retries already consumed
     * @return Duration to wait before the next invocation
     */
    public Duration computeDelay(int retryCount) {
        return delay(retryCount, backoffMultiplier, baseDelay, maxDelay);
    }

    /**
     * Check if another retry is available.
     */
    public boolean hasRetriesLeft(int retryCount) {
        return retryCount < maxRetries;
    }

    private static Duration delay(int retryCount, double multiplier, Duration baseDelay, Duration maxDelay) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        double delayMs = baseDelay.toMillis() * Math.pow(multiplier, retryCount);
        double cappedMs = Math.min(delayMs, maxDelay.toMillis());
        return Duration.ofMillis((long) cappedMs);
    }

    /**
     * Builder for RetryPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofHours(1);

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, baseDelay, backoffMultiplier, maxDelay);
        }
    }
}
