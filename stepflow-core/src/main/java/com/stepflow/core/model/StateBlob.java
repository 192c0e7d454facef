package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Accumulated state of an execution, stored as one JSON document:
 * <pre>
 * {
 *   "trigger": { ...payload that started the execution... },
 *   "outputs": { "nodeA": {...}, "nodeB": {...} },
 *   "signals": { "approval": {...} },
 *   "received": { "nodeC": {...} }
 * }
 * </pre>
 * {@code signals} holds the latest payload of each signal type. {@code received} holds the
 * payload that resumed a waiting node, keyed by that node, until the node completes; it is
 * created on first use. All operations return a new document; the input is never mutated.
 */
public final class StateBlob {

    public static final String TRIGGER = "trigger";
    public static final String OUTPUTS = "outputs";
    public static final String SIGNALS = "signals";
    public static final String RECEIVED = "received";

    private StateBlob() {
    }

    /**
     * Create the initial state for a fresh execution.
     */
    public static ObjectNode initial(JsonNode triggerPayload) {
        ObjectNode blob = JsonNodeFactory.instance.objectNode();
        blob.set(TRIGGER, triggerPayload != null ? triggerPayload.deepCopy() : NullNode.getInstance());
        blob.putObject(OUTPUTS);
        blob.putObject(SIGNALS);
        return blob;
    }

    /**
     * Record the output of a completed node and drop the signal it was resumed with.
     */
    public static ObjectNode withOutput(JsonNode blob, String nodeId, JsonNode output) {
        ObjectNode copy = normalize(blob);
        ((ObjectNode) copy.get(OUTPUTS)).set(nodeId, output != null ? output.deepCopy() : NullNode.getInstance());
        if (copy.get(RECEIVED) instanceof ObjectNode) {
            ((ObjectNode) copy.get(RECEIVED)).remove(nodeId);
        }
        return copy;
    }

    /**
     * Merge a delivered signal payload under its type.
     */
    public static ObjectNode withSignal(JsonNode blob, String signalType, JsonNode payload) {
        ObjectNode copy = normalize(blob);
        ((ObjectNode) copy.get(SIGNALS)).set(signalType, payload != null ? payload.deepCopy() : NullNode.getInstance());
        return copy;
    }

    /**
     * Record the payload of a signal delivered to the node waiting at {@code nodeId}.
     */
    public static ObjectNode withReceivedSignal(JsonNode blob, String nodeId, JsonNode payload) {
        ObjectNode copy = normalize(blob);
        JsonNode received = copy.get(RECEIVED);
        ObjectNode target = received instanceof ObjectNode ? (ObjectNode) received : copy.putObject(RECEIVED);
        target.set(nodeId, payload != null ? payload.deepCopy() : NullNode.getInstance());
        return copy;
    }

    public static JsonNode output(JsonNode blob, String nodeId) {
        JsonNode outputs = blob != null ? blob.get(OUTPUTS) : null;
        return outputs != null ? outputs.get(nodeId) : null;
    }

    public static JsonNode signal(JsonNode blob, String signalType) {
        JsonNode signals = blob != null ? blob.get(SIGNALS) : null;
        return signals != null ? signals.get(signalType) : null;
    }

    /**
     * The signal payload that resumed {@code nodeId}, or null if it has not been signalled.
     */
    public static JsonNode receivedSignal(JsonNode blob, String nodeId) {
        JsonNode received = blob != null ? blob.get(RECEIVED) : null;
        return received != null ? received.get(nodeId) : null;
    }

    private static ObjectNode normalize(JsonNode blob) {
        ObjectNode copy = blob instanceof ObjectNode
            ? ((ObjectNode) blob).deepCopy()
            : initial(null);
        if (!(copy.get(OUTPUTS) instanceof ObjectNode)) {
            copy.putObject(OUTPUTS);
        }
        if (!(copy.get(SIGNALS) instanceof ObjectNode)) {
            copy.putObject(SIGNALS);
        }
        return copy;
    }
}
