package com.stepflow.core.validation;

import com.stepflow.core.exception.WorkflowValidationException;
import com.stepflow.core.model.NodeDefinition;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.schedule.CronExpressions;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run before a workflow definition version is published.
 */
public final class WorkflowDefinitionValidator {

    private WorkflowDefinitionValidator() {
    }

    /**
     * @throws WorkflowValidationException describing the first problem found
     */
    public static void validate(WorkflowDefinition definition) {
        if (definition.workflowId() == null || definition.workflowId().isBlank()) {
            throw new WorkflowValidationException("workflowId", "must not be blank");
        }
        if (definition.nodes().isEmpty()) {
            throw new WorkflowValidationException("nodes", "at least one node is required");
        }

        Set<String> nodeIds = new HashSet<>();
        for (NodeDefinition node : definition.nodes()) {
            if (node.nodeId() == null || node.nodeId().isBlank()) {
                throw new WorkflowValidationException("nodes", "node id must not be blank");
            }
            if (node.type() == null || node.type().isBlank()) {
                throw new WorkflowValidationException("nodes", "node " + node.nodeId() + " has no type");
            }
            if (!nodeIds.add(node.nodeId())) {
                throw new WorkflowValidationException("nodes", "duplicate node id " + node.nodeId());
            }
        }

        if (!nodeIds.contains(definition.entryNodeId())) {
            throw new WorkflowValidationException("entryNodeId",
                "unknown node " + definition.entryNodeId());
        }

        for (Map.Entry<String, List<String>> edge : definition.edges().entrySet()) {
            if (!nodeIds.contains(edge.getKey())) {
                throw new WorkflowValidationException("edges", "unknown source node " + edge.getKey());
            }
            for (String target : edge.getValue()) {
                if (!nodeIds.contains(target)) {
                    throw new WorkflowValidationException("edges",
                        "unknown target node " + target + " from " + edge.getKey());
                }
            }
        }

        checkAcyclic(definition);

        if (definition.triggerConfig().hasCron()) {
            CronExpressions.validate(definition.triggerConfig().cronExpression());
        }
    }

    private static void checkAcyclic(WorkflowDefinition definition) {
        Map<String, Integer> marks = new HashMap<>();
        for (NodeDefinition node : definition.nodes()) {
            visit(node.nodeId(), definition, marks);
        }
    }

    // 1 = on the current path, 2 = fully explored
    private static void visit(String nodeId, WorkflowDefinition definition, Map<String, Integer> marks) {
        Integer mark = marks.get(nodeId);
        if (mark != null) {
            if (mark == 1) {
                throw new WorkflowValidationException("edges", "cycle through node " + nodeId);
            }
            return;
        }
        marks.put(nodeId, 1);
        for (String next : definition.successorsOf(nodeId)) {
            visit(next, definition, marks);
        }
        marks.put(nodeId, 2);
    }
}
