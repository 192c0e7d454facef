package com.stepflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable definition of one version of a workflow.
 * Publishing a change creates a new version; running executions stay pinned
 * to the version they started with.
 *
 * Primary Key: {workflowId}:{version}
 *
 * Invariants:
 * - node ids are unique
 * - entryNodeId and all edge targets exist in nodes
 * - graph is acyclic
 * - a node with no outgoing edges is terminal
 */
public record WorkflowDefinition(
    // Identity
    String workflowId,
    int version,

    // Graph structure
    List<NodeDefinition> nodes,
    Map<String, List<String>> edges,
    String entryNodeId,

    // Policies
    TriggerConfig triggerConfig,
    RetryPolicy retryPolicy,
    boolean active,

    // Metadata
    String name,
    String description,
    Instant createdAt
) {
    public WorkflowDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? Map.of() : Map.copyOf(edges);
        if (entryNodeId == null && !nodes.isEmpty()) {
            entryNodeId = nodes.get(0).nodeId();
        }
        if (triggerConfig == null) {
            triggerConfig = TriggerConfig.manual();
        }
    }

    /**
     * Construct the unique identifier for this workflow definition version.
     */
    public String id() {
        return workflowId + ":" + version;
    }

    /**
     * Get a node definition by ID.
     */
    public Optional<NodeDefinition> getNode(String nodeId) {
        return nodes.stream()
            .filter(n -> n.nodeId().equals(nodeId))
            .findFirst();
    }

    /**
     * Get the declared successors of the given node, in declaration order.
     */
    public List<String> successorsOf(String nodeId) {
        return edges.getOrDefault(nodeId, List.of());
    }

    /**
     * Check if a node has no successors.
     */
    public boolean isTerminalNode(String nodeId) {
        return successorsOf(nodeId).isEmpty();
    }

    /**
     * Effective retry policy: the workflow override, or the given default.
     */
    public RetryPolicy effectiveRetryPolicy(RetryPolicy defaultPolicy) {
        return retryPolicy != null ? retryPolicy : defaultPolicy;
    }

    public WorkflowDefinition withVersion(int version, Instant createdAt) {
        return new WorkflowDefinition(workflowId, version, nodes, edges, entryNodeId,
            triggerConfig, retryPolicy, active, name, description, createdAt);
    }

    public WorkflowDefinition withActive(boolean active) {
        return new WorkflowDefinition(workflowId, version, nodes, edges, entryNodeId,
            triggerConfig, retryPolicy, active, name, description, createdAt);
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workflowId;
        private int version = 1;
        private List<NodeDefinition> nodes = List.of();
        private Map<String, List<String>> edges = Map.of();
        private String entryNodeId;
        private TriggerConfig triggerConfig = TriggerConfig.manual();
        private RetryPolicy retryPolicy;
        private boolean active = true;
        private String name;
        private String description;
        private Instant createdAt = Instant.now();

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder nodes(List<NodeDefinition> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder edges(Map<String, List<String>> edges) {
            this.edges = edges;
            return this;
        }

        public Builder entryNodeId(String entryNodeId) {
            this.entryNodeId = entryNodeId;
            return this;
        }

        public Builder triggerConfig(TriggerConfig triggerConfig) {
            this.triggerConfig = triggerConfig;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                workflowId, version, nodes, edges, entryNodeId,
                triggerConfig, retryPolicy, active, name, description, createdAt
            );
        }
    }
}
