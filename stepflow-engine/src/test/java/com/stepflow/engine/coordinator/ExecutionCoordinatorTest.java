package com.stepflow.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowInactiveException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.StateBlob;
import com.stepflow.core.model.TriggerConfig;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.service.WorkflowDefinitionService;
import com.stepflow.engine.test.InMemoryStepflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ExecutionCoordinatorTest {

    private InMemoryStepflow stepflow;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        stepflow = new InMemoryStepflow();
        coordinator = stepflow.coordinator();
        stepflow.register(TestWorkflows.linear("orders", "validate", "charge"));
        stepflow.register(TestWorkflows.linearBuilder("orders", "validate", "charge", "ship")
            .version(2)
            .triggerConfig(new TriggerConfig(null, "orders-hook"))
            .build());
    }

    @Test
    @DisplayName("Manual trigger starts the latest version with the payload as trigger state")
    void triggerUsesLatestVersion() {
        Execution execution = coordinator.trigger("orders", JsonNodeFactory.instance.objectNode().put("id", 9));

        assertThat(execution.status()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(execution.workflowVersion()).isEqualTo(2);
        assertThat(execution.currentNodeId()).isEqualTo("validate");
        assertThat(execution.stateBlob().get(StateBlob.TRIGGER).get("id").asInt()).isEqualTo(9);
        assertThat(stepflow.store.findLogs(LogQuery.page(execution.executionId(), 0, 10)))
            .extracting(ExecutionLogEntry::message)
            .containsExactly("Execution created by manual trigger on version 2");
        assertThat(stepflow.meterRegistry.find(ExecutionMetrics.EXECUTIONS_CREATED)
            .tag("origin", "manual").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Webhook trigger resolves the workflow by path")
    void webhookTrigger() {
        Execution execution = coordinator.triggerWebhook("orders-hook", null);

        assertThat(execution.workflowId()).isEqualTo("orders");
        assertThatThrownBy(() -> coordinator.triggerWebhook("unknown", null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A deactivated workflow does not shadow an active one sharing its webhook path")
    void webhookSkipsInactiveWorkflows() {
        WorkflowDefinitionService definitions = stepflow.definitionService();
        definitions.publish(TestWorkflows.linearBuilder("a-legacy", "intake")
            .triggerConfig(new TriggerConfig(null, "shared-hook"))
            .build());
        definitions.deactivate("a-legacy");
        definitions.publish(TestWorkflows.linearBuilder("b-current", "intake")
            .triggerConfig(new TriggerConfig(null, "shared-hook"))
            .build());

        Execution execution = coordinator.triggerWebhook("shared-hook", null);

        assertThat(execution.workflowId()).isEqualTo("b-current");

        definitions.deactivate("b-current");
        assertThatThrownBy(() -> coordinator.triggerWebhook("shared-hook", null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Unknown and inactive workflows cannot be triggered")
    void triggerRejectsUnknownAndInactive() {
        assertThatThrownBy(() -> coordinator.trigger("missing", null))
            .isInstanceOf(NotFoundException.class);

        stepflow.definitions.deactivate("orders");
        assertThatThrownBy(() -> coordinator.trigger("orders", null))
            .isInstanceOf(WorkflowInactiveException.class);
        assertThat(stepflow.store.query(ExecutionQuery.all())).isEmpty();
    }

    @Test
    @DisplayName("Cancelling an idle execution finishes it at once; a leased one is flagged")
    void cancel() {
        Execution idle = coordinator.trigger("orders", null);
        Execution cancelled = coordinator.cancel(idle.executionId(), "no longer needed");
        assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);

        Execution busy = coordinator.trigger("orders", null);
        stepflow.store.claim("w1", Duration.ofSeconds(30)).orElseThrow();
        Execution flagged = coordinator.cancel(busy.executionId(), null);
        assertThat(flagged.status()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(flagged.cancelRequested()).isTrue();
    }

    @Test
    @DisplayName("Pause and resume round trip through the store")
    void pauseAndResume() {
        Execution execution = coordinator.trigger("orders", null);

        assertThat(coordinator.pause(execution.executionId()).isExplicitlyPaused()).isTrue();
        Execution resumed = coordinator.resume(execution.executionId());

        assertThat(resumed.nextRetryAt()).isEqualTo(stepflow.clock.instant());
        assertThat(coordinator.getExecution(execution.executionId()).isExplicitlyPaused()).isFalse();
        assertThatThrownBy(() -> coordinator.getExecution("missing"))
            .isInstanceOf(NotFoundException.class);
    }
}
