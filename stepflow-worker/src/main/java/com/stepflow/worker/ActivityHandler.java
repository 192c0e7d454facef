package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one node type.
 * Registered with {@link HandlerRegistryActivityInvoker} under the type tag nodes declare.
 */
@FunctionalInterface
public interface ActivityHandler {

    /**
     * Run the node.
     *
     * @param context node configuration, accumulated state and control over the outcome
     * @return output merged into the state blob under {@code outputs.<nodeId>}; may be null
     * @throws ActivityException if the node fails
     */
    JsonNode execute(ActivityContext context) throws ActivityException;
}
