package com.stepflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.NodeDefinition;
import com.stepflow.core.model.RetryPolicy;
import com.stepflow.core.model.TriggerConfig;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.engine.service.ExecutionService;
import com.stepflow.engine.service.WorkflowDefinitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for workflow definitions.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowDefinitionService definitionService;
    private final ExecutionService executionService;

    public WorkflowController(WorkflowDefinitionService definitionService,
                              ExecutionService executionService) {
        this.definitionService = definitionService;
        this.executionService = executionService;
    }

    /**
     * Publish a workflow definition as its next version.
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> publish(@RequestBody PublishWorkflowRequest request) {
        WorkflowDefinition published = definitionService.publish(request.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(published));
    }

    /**
     * Latest version of every workflow.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> list() {
        List<WorkflowResponse> responses = definitionService.listLatest().stream()
            .map(WorkflowResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> getLatest(@PathVariable String workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(definitionService.getLatest(workflowId)));
    }

    @GetMapping("/{workflowId}/versions")
    public ResponseEntity<List<WorkflowResponse>> listVersions(@PathVariable String workflowId) {
        List<WorkflowResponse> responses = definitionService.listVersions(workflowId).stream()
            .map(WorkflowResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{workflowId}/versions/{version}")
    public ResponseEntity<WorkflowResponse> getVersion(
            @PathVariable String workflowId,
            @PathVariable int version) {
        return ResponseEntity.ok(WorkflowResponse.from(definitionService.get(workflowId, version)));
    }

    /**
     * Deactivate a workflow. Triggers are refused and its schedules stop;
     * running executions are left alone.
     */
    @PostMapping("/{workflowId}/deactivate")
    public ResponseEntity<WorkflowResponse> deactivate(@PathVariable String workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(definitionService.deactivate(workflowId)));
    }

    /**
     * Manually trigger the latest version of a workflow.
     */
    @PostMapping("/{workflowId}/executions")
    public ResponseEntity<ExecutionController.ExecutionResponse> trigger(
            @PathVariable String workflowId,
            @RequestBody(required = false) JsonNode payload) {
        Execution execution = executionService.trigger(workflowId, payload);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ExecutionController.ExecutionResponse.from(execution));
    }

    // ========== DTOs ==========

    public record NodeRequest(String nodeId, String type, JsonNode config, Long timeoutMs) {
        NodeDefinition toNode() {
            return new NodeDefinition(nodeId, type, config,
                timeoutMs != null ? Duration.ofMillis(timeoutMs) : null);
        }
    }

    public record RetryPolicyRequest(
        int maxRetries,
        long baseDelayMs,
        double backoffMultiplier,
        long maxDelayMs
    ) {
        RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs),
                backoffMultiplier, Duration.ofMillis(maxDelayMs));
        }
    }

    public record PublishWorkflowRequest(
        String workflowId,
        String name,
        String description,
        List<NodeRequest> nodes,
        Map<String, List<String>> edges,
        String entryNodeId,
        String cronExpression,
        String webhookPath,
        RetryPolicyRequest retryPolicy
    ) {
        WorkflowDefinition toDefinition() {
            List<NodeDefinition> nodeDefinitions = nodes == null ? List.of() : nodes.stream()
                .map(NodeRequest::toNode)
                .collect(Collectors.toList());
            return WorkflowDefinition.builder()
                .workflowId(workflowId)
                .name(name)
                .description(description)
                .nodes(nodeDefinitions)
                .edges(edges)
                .entryNodeId(entryNodeId)
                .triggerConfig(new TriggerConfig(cronExpression, webhookPath))
                .retryPolicy(retryPolicy != null ? retryPolicy.toPolicy() : null)
                .build();
        }
    }

    public record NodeResponse(String nodeId, String type, JsonNode config, Long timeoutMs) {
        static NodeResponse from(NodeDefinition node) {
            return new NodeResponse(node.nodeId(), node.type(), node.config(),
                node.timeout() != null ? node.timeout().toMillis() : null);
        }
    }

    public record WorkflowResponse(
        String workflowId,
        int version,
        String name,
        String description,
        List<NodeResponse> nodes,
        Map<String, List<String>> edges,
        String entryNodeId,
        String cronExpression,
        String webhookPath,
        RetryPolicyRequest retryPolicy,
        boolean active,
        Instant createdAt
    ) {
        public static WorkflowResponse from(WorkflowDefinition definition) {
            RetryPolicy policy = definition.retryPolicy();
            return new WorkflowResponse(
                definition.workflowId(),
                definition.version(),
                definition.name(),
                definition.description(),
                definition.nodes().stream().map(NodeResponse::from).collect(Collectors.toList()),
                definition.edges(),
                definition.entryNodeId(),
                definition.triggerConfig().cronExpression(),
                definition.triggerConfig().webhookPath(),
                policy == null ? null : new RetryPolicyRequest(policy.maxRetries(),
                    policy.baseDelay().toMillis(), policy.backoffMultiplier(), policy.maxDelay().toMillis()),
                definition.active(),
                definition.createdAt()
            );
        }
    }
}
