package com.stepflow.core.exception;

import com.stepflow.core.model.ExecutionStatus;

/**
 * Thrown when an operation is not allowed in the execution's current status.
 */
public class InvalidStateTransitionException extends StepflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String executionId, ExecutionStatus currentStatus, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s execution %s in status %s",
            operation, executionId, currentStatus
        ));
    }
}
