package com.stepflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.Execution;
import com.stepflow.engine.service.ExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Starts the workflow registered under a webhook path.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private final ExecutionService executionService;

    public WebhookController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @PostMapping("/{path}")
    public ResponseEntity<ExecutionController.ExecutionResponse> receive(
            @PathVariable String path,
            @RequestBody(required = false) JsonNode payload) {
        Execution execution = executionService.triggerWebhook(path, payload);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ExecutionController.ExecutionResponse.from(execution));
    }
}
