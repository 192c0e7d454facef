package com.stepflow.core.exception;

/**
 * Thrown when a trigger targets a deactivated workflow.
 */
public class WorkflowInactiveException extends StepflowException {

    public static final String ERROR_CODE = "WORKFLOW_INACTIVE";

    public WorkflowInactiveException(String workflowId) {
        super(ERROR_CODE, "Workflow is not active: " + workflowId);
    }
}
