package com.stepflow.core.exception;

/**
 * Thrown when a workflow, execution, schedule or signal is not found.
 */
public class NotFoundException extends StepflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
