package com.stepflow.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.Signal;
import com.stepflow.engine.history.ExecutionSummary;
import com.stepflow.engine.history.LogPage;
import com.stepflow.engine.signal.SignalRouter;

import java.util.List;

/**
 * Trigger and query operations on executions.
 */
public interface ExecutionService {

    /**
     * Start an execution of the latest active version of a workflow.
     *
     * @param workflowId The workflow to run
     * @param payload The trigger payload, stored under {@code trigger} in the state blob
     * @return The created PENDING execution
     */
    Execution trigger(String workflowId, JsonNode payload);

    /**
     * Start an execution of the workflow whose trigger declares the given webhook path.
     */
    Execution triggerWebhook(String webhookPath, JsonNode payload);

    /**
     * Cancel an execution. Takes effect immediately unless a worker holds it,
     * in which case the worker cancels it before invoking another node.
     */
    Execution cancel(String executionId, String reason);

    /**
     * Pause an execution no worker currently holds.
     */
    Execution pause(String executionId);

    /**
     * Make a paused or waiting execution due immediately.
     */
    Execution resume(String executionId);

    /**
     * Start a new execution from a node of a FAILED execution.
     *
     * @param executionId The failed execution
     * @param fromNodeId The node to restart from, null for the failing node
     * @return The new PENDING execution
     */
    Execution replay(String executionId, String fromNodeId);

    /**
     * Deliver a signal to an execution.
     */
    SignalRouter.Delivery sendSignal(String executionId, String signalType, JsonNode payload);

    Execution getExecution(String executionId);

    List<Execution> queryExecutions(ExecutionQuery query);

    LogPage getLogs(LogQuery query);

    List<ExecutionCheckpoint> getCheckpoints(String executionId);

    List<Signal> getSignals(String executionId);

    ExecutionSummary getSummary(String executionId);
}
