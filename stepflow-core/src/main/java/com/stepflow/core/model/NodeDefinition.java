package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;

/**
 * A single step of a workflow graph.
 *
 * @param nodeId unique within the workflow definition
 * @param type tag used to dispatch to an activity handler
 * @param config opaque configuration handed to the handler
 * @param timeout per-invocation timeout, null for the engine default
 */
public record NodeDefinition(
    String nodeId,
    String type,
    JsonNode config,
    Duration timeout
) {
    public NodeDefinition {
        if (config == null) {
            config = JsonNodeFactory.instance.objectNode();
        }
    }

    public static NodeDefinition of(String nodeId, String type) {
        return new NodeDefinition(nodeId, type, null, null);
    }

    public static NodeDefinition of(String nodeId, String type, JsonNode config) {
        return new NodeDefinition(nodeId, type, config, null);
    }
}
