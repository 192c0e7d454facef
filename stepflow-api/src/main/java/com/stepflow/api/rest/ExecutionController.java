package com.stepflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionCheckpoint;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogLevel;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.Signal;
import com.stepflow.engine.history.ExecutionSummary;
import com.stepflow.engine.history.LogPage;
import com.stepflow.engine.service.ExecutionService;
import com.stepflow.engine.signal.SignalRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for executions: inspection, lifecycle control, signals and replay.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private final ExecutionService executionService;

    public ExecutionController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> query(
            @RequestParam(required = false) String workflowId,
            @RequestParam(required = false) ExecutionStatus status,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        List<ExecutionResponse> responses = executionService
            .queryExecutions(new ExecutionQuery(workflowId, status, limit, offset)).stream()
            .map(ExecutionResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionResponse> get(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(executionService.getExecution(executionId)));
    }

    @GetMapping("/{executionId}/summary")
    public ResponseEntity<ExecutionSummary> summary(@PathVariable String executionId) {
        return ResponseEntity.ok(executionService.getSummary(executionId));
    }

    /**
     * Paginated audit log, optionally filtered by node and level.
     */
    @GetMapping("/{executionId}/logs")
    public ResponseEntity<LogPageResponse> logs(
            @PathVariable String executionId,
            @RequestParam(required = false) String nodeId,
            @RequestParam(required = false) LogLevel level,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "100") int limit) {

        LogPage page = executionService.getLogs(new LogQuery(executionId, nodeId, level, offset, limit));
        return ResponseEntity.ok(LogPageResponse.from(page));
    }

    @GetMapping("/{executionId}/checkpoints")
    public ResponseEntity<List<ExecutionCheckpoint>> checkpoints(@PathVariable String executionId) {
        return ResponseEntity.ok(executionService.getCheckpoints(executionId));
    }

    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<ExecutionResponse> cancel(
            @PathVariable String executionId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(ExecutionResponse.from(executionService.cancel(executionId, reason)));
    }

    @PostMapping("/{executionId}/pause")
    public ResponseEntity<ExecutionResponse> pause(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(executionService.pause(executionId)));
    }

    @PostMapping("/{executionId}/resume")
    public ResponseEntity<ExecutionResponse> resume(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(executionService.resume(executionId)));
    }

    /**
     * Start a new execution from a node of a failed one.
     * Without a node, replay starts from the node that failed.
     */
    @PostMapping("/{executionId}/replay")
    public ResponseEntity<ExecutionResponse> replay(
            @PathVariable String executionId,
            @RequestBody(required = false) ReplayRequest request) {
        String fromNodeId = request != null ? request.fromNodeId() : null;
        Execution replay = executionService.replay(executionId, fromNodeId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ExecutionResponse.from(replay));
    }

    @PostMapping("/{executionId}/signals")
    public ResponseEntity<SignalDeliveryResponse> sendSignal(
            @PathVariable String executionId,
            @RequestBody SignalRequest request) {
        SignalRouter.Delivery delivery =
            executionService.sendSignal(executionId, request.signalType(), request.payload());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SignalDeliveryResponse.from(delivery));
    }

    @GetMapping("/{executionId}/signals")
    public ResponseEntity<List<Signal>> signals(@PathVariable String executionId) {
        return ResponseEntity.ok(executionService.getSignals(executionId));
    }

    // ========== DTOs ==========

    public record CancelRequest(String reason) {}

    public record ReplayRequest(String fromNodeId) {}

    public record SignalRequest(String signalType, JsonNode payload) {}

    public record SignalDeliveryResponse(String signalId, String signalType, boolean resumed,
                                         ExecutionStatus executionStatus) {
        static SignalDeliveryResponse from(SignalRouter.Delivery delivery) {
            return new SignalDeliveryResponse(
                delivery.signal().signalId(),
                delivery.signal().signalType(),
                delivery.resumed(),
                delivery.execution() != null ? delivery.execution().status() : null
            );
        }
    }

    public record LogPageResponse(List<ExecutionLogEntry> entries, long total, int offset, int limit,
                                  boolean hasMore) {
        static LogPageResponse from(LogPage page) {
            return new LogPageResponse(page.entries(), page.total(), page.offset(), page.limit(),
                page.hasMore());
        }
    }

    public record ExecutionResponse(
        String executionId,
        String workflowId,
        int workflowVersion,
        ExecutionStatus status,
        String currentNodeId,
        JsonNode state,
        long stepCount,
        int retryCount,
        Instant nextRetryAt,
        String leaseOwner,
        Instant leaseExpiresAt,
        String awaitingSignalType,
        boolean cancelRequested,
        String replayOf,
        String replayFromNodeId,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String error,
        String errorNodeId
    ) {
        public static ExecutionResponse from(Execution execution) {
            return new ExecutionResponse(
                execution.executionId(),
                execution.workflowId(),
                execution.workflowVersion(),
                execution.status(),
                execution.currentNodeId(),
                execution.stateBlob(),
                execution.stepCount(),
                execution.retryCount(),
                execution.nextRetryAt(),
                execution.leaseOwner(),
                execution.leaseExpiresAt(),
                execution.awaitingSignalType(),
                execution.cancelRequested(),
                execution.replayOf(),
                execution.replayFromNodeId(),
                execution.createdAt(),
                execution.startedAt(),
                execution.completedAt(),
                execution.error(),
                execution.errorNodeId()
            );
        }
    }
}
