package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.activity.ActivityRequest;
import com.stepflow.core.model.StateBlob;

/**
 * Context handed to an {@link ActivityHandler} for one invocation.
 *
 * Besides read access to the node and the accumulated state, a handler can
 * pick its successor with {@link #goTo(String)} or suspend the execution
 * until a signal arrives with {@link #awaitSignal(String)}. A suspended node
 * is invoked again once the signal is delivered; its payload is then visible
 * through {@link #getSignal(String)}.
 */
public class ActivityContext {

    private final ActivityRequest request;
    private final ObjectMapper objectMapper;

    private String nextNodeId;
    private String awaitedSignalType;

    public ActivityContext(ActivityRequest request, ObjectMapper objectMapper) {
        this.request = request;
        this.objectMapper = objectMapper;
    }

    public ActivityRequest getRequest() {
        return request;
    }

    public String getExecutionId() {
        return request.executionId();
    }

    public String getWorkflowId() {
        return request.workflowId();
    }

    public String getNodeId() {
        return request.node().nodeId();
    }

    /**
     * Static configuration of the node from the workflow definition.
     */
    public JsonNode getConfig() {
        return request.node().config();
    }

    public <T> T getConfig(Class<T> type) {
        return objectMapper.convertValue(request.node().config(), type);
    }

    /**
     * The whole state blob: trigger payload, node outputs and received signals.
     */
    public JsonNode getState() {
        return request.state();
    }

    /**
     * Payload the execution was triggered with.
     */
    public JsonNode getTrigger() {
        JsonNode state = request.state();
        return state != null ? state.get(StateBlob.TRIGGER) : null;
    }

    /**
     * Output of an earlier node, null if it has not run.
     */
    public JsonNode getOutput(String nodeId) {
        return StateBlob.output(request.state(), nodeId);
    }

    /**
     * Payload of a received signal, null if none arrived.
     */
    public JsonNode getSignal(String signalType) {
        return StateBlob.signal(request.state(), signalType);
    }

    /**
     * Payload of the signal that resumed this node, null until one is delivered to it.
     */
    public JsonNode getReceivedSignal() {
        return StateBlob.receivedSignal(request.state(), getNodeId());
    }

    public int getRetryCount() {
        return request.retryCount();
    }

    /**
     * Key for external calls, identical across retries of this step.
     */
    public String getIdempotencyKey() {
        return request.idempotencyKey();
    }

    /**
     * Extend the lease. Long-running handlers should call this well within the lease duration.
     *
     * @return false if the lease was lost; the result of this invocation will be discarded
     */
    public boolean heartbeat() {
        return request.heartbeat() == null || request.heartbeat().beat();
    }

    /**
     * Continue with the given declared successor instead of the first one.
     */
    public void goTo(String nodeId) {
        this.nextNodeId = nodeId;
    }

    /**
     * Suspend the execution until a signal of the given type is delivered.
     * The returned output is ignored.
     */
    public void awaitSignal(String signalType) {
        this.awaitedSignalType = signalType;
    }

    public JsonNode toJsonNode(Object value) {
        return objectMapper.valueToTree(value);
    }

    String nextNodeId() {
        return nextNodeId;
    }

    String awaitedSignalType() {
        return awaitedSignalType;
    }
}
