package com.stepflow.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowInactiveException;
import com.stepflow.core.exception.WorkflowValidationException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.service.ExecutionService;
import com.stepflow.engine.service.WorkflowDefinitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkflowControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private WorkflowDefinitionService definitionService;
    private ExecutionService executionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        definitionService = mock(WorkflowDefinitionService.class);
        executionService = mock(ExecutionService.class);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        mockMvc = MockMvcBuilders
            .standaloneSetup(new WorkflowController(definitionService, executionService))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
    }

    @Test
    void publishMapsRequestToDefinition() throws Exception {
        when(definitionService.publish(any())).thenAnswer(inv -> {
            WorkflowDefinition draft = inv.getArgument(0);
            return draft.withVersion(1, NOW);
        });

        String body = """
            {
              "workflowId": "orders",
              "name": "Order flow",
              "nodes": [
                {"nodeId": "validate", "type": "pass"},
                {"nodeId": "charge", "type": "payment", "config": {"currency": "EUR"}, "timeoutMs": 2000}
              ],
              "edges": {"validate": ["charge"]},
              "cronExpression": "0 2 * * *",
              "retryPolicy": {"maxRetries": 5, "baseDelayMs": 100, "backoffMultiplier": 2.0, "maxDelayMs": 1000}
            }
            """;

        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.workflowId").value("orders"))
            .andExpect(jsonPath("$.version").value(1))
            .andExpect(jsonPath("$.entryNodeId").value("validate"))
            .andExpect(jsonPath("$.nodes[1].timeoutMs").value(2000))
            .andExpect(jsonPath("$.retryPolicy.maxRetries").value(5));

        ArgumentCaptor<WorkflowDefinition> captor = ArgumentCaptor.forClass(WorkflowDefinition.class);
        verify(definitionService).publish(captor.capture());
        WorkflowDefinition draft = captor.getValue();
        assertThat(draft.nodes()).hasSize(2);
        assertThat(draft.getNode("charge").orElseThrow().timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(draft.getNode("charge").orElseThrow().config().path("currency").asText()).isEqualTo("EUR");
        assertThat(draft.triggerConfig().cronExpression()).isEqualTo("0 2 * * *");
        assertThat(draft.retryPolicy().baseDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void invalidDefinitionIsBadRequest() throws Exception {
        when(definitionService.publish(any()))
            .thenThrow(new WorkflowValidationException("edges", "cycle detected"));

        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflowId\": \"loop\", \"nodes\": [{\"nodeId\": \"a\", \"type\": \"pass\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(WorkflowValidationException.ERROR_CODE));
    }

    @Test
    void invalidRetryPolicyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"workflowId": "w", "nodes": [{"nodeId": "a", "type": "pass"}],
                     "retryPolicy": {"maxRetries": 1, "baseDelayMs": 100, "backoffMultiplier": 0.5, "maxDelayMs": 1000}}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    void listsVersions() throws Exception {
        WorkflowDefinition v1 = TestWorkflows.linear("orders", "A", "B");
        when(definitionService.listVersions("orders")).thenReturn(List.of(v1, v1.withVersion(2, NOW)));

        mockMvc.perform(get("/api/v1/workflows/orders/versions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[1].version").value(2));
    }

    @Test
    void unknownWorkflowIsNotFound() throws Exception {
        when(definitionService.getLatest("missing")).thenThrow(new NotFoundException("Workflow", "missing"));

        mockMvc.perform(get("/api/v1/workflows/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value(NotFoundException.ERROR_CODE))
            .andExpect(jsonPath("$.message").value("Workflow not found: missing"));
    }

    @Test
    void triggerCreatesExecution() throws Exception {
        WorkflowDefinition definition = TestWorkflows.linear("orders", "A", "B");
        Execution execution = Execution.create(definition, null, NOW);
        when(executionService.trigger(eq("orders"), any())).thenReturn(execution);

        mockMvc.perform(post("/api/v1/workflows/orders/executions")
                .contentType(MediaType.APPLICATION_JSON).content("{\"orderId\": 42}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.executionId").value(execution.executionId()))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.currentNodeId").value("A"));
    }

    @Test
    void triggerWithoutBodyPassesNullPayload() throws Exception {
        WorkflowDefinition definition = TestWorkflows.linear("orders", "A");
        when(executionService.trigger(eq("orders"), isNull()))
            .thenReturn(Execution.create(definition, null, NOW));

        mockMvc.perform(post("/api/v1/workflows/orders/executions"))
            .andExpect(status().isCreated());

        verify(executionService).trigger(eq("orders"), isNull());
    }

    @Test
    void triggerOnInactiveWorkflowIsConflict() throws Exception {
        when(executionService.trigger(eq("old"), any())).thenThrow(new WorkflowInactiveException("old"));

        mockMvc.perform(post("/api/v1/workflows/old/executions")
                .contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value(WorkflowInactiveException.ERROR_CODE));
    }
}
