package com.stepflow.worker;

/**
 * Failure reported by an {@link ActivityHandler}.
 * Retryable failures are retried under the workflow's retry policy; the others fail the execution.
 */
public class ActivityException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public ActivityException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ActivityException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * A failure that retrying cannot fix, such as invalid input.
     */
    public static ActivityException fatal(String errorCode, String message) {
        return new ActivityException(errorCode, message, false);
    }

    /**
     * A transient failure, such as an unavailable downstream service.
     */
    public static ActivityException retryable(String errorCode, String message) {
        return new ActivityException(errorCode, message, true);
    }
}
