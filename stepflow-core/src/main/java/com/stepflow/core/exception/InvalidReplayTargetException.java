package com.stepflow.core.exception;

/**
 * Thrown when a replay names a node the failed execution never reached.
 */
public class InvalidReplayTargetException extends StepflowException {

    public static final String ERROR_CODE = "INVALID_REPLAY_TARGET";

    public InvalidReplayTargetException(String executionId, String nodeId) {
        super(ERROR_CODE, String.format(
            "Node %s is not a valid replay point for execution %s",
            nodeId, executionId
        ));
    }
}
