package com.stepflow.core.exception;

/**
 * Thrown when a worker writes to an execution whose lease it no longer holds.
 * The write is rejected; the worker must abandon the tick.
 */
public class LeaseLostException extends StepflowException {

    public static final String ERROR_CODE = "LEASE_LOST";

    public LeaseLostException(String executionId, String workerId) {
        super(ERROR_CODE, String.format(
            "Worker %s no longer holds the lease on execution %s",
            workerId, executionId
        ));
    }
}
