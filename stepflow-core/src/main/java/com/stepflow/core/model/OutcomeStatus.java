package com.stepflow.core.model;

/**
 * Result kind of a single node invocation.
 */
public enum OutcomeStatus {
    SUCCESS,
    RETRYABLE_FAILURE,
    FATAL_FAILURE,
    SUSPEND
}
