package com.stepflow.core.model;

/**
 * Classification of an activity failure.
 */
public enum ErrorClass {
    /**
     * Transient; the node may succeed if invoked again.
     */
    RETRYABLE,

    /**
     * Permanent; retrying cannot help.
     */
    FATAL
}
