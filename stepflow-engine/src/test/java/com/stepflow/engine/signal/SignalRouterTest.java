package com.stepflow.engine.signal;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowValidationException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.NodeOutcome;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.StateBlob;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.test.InMemoryStepflow;
import com.stepflow.engine.test.ScriptedInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SignalRouterTest {

    private static final Duration LEASE = Duration.ofSeconds(30);

    private InMemoryStepflow stepflow;
    private SignalRouter router;
    private WorkflowDefinition approval;

    @BeforeEach
    void setUp() {
        stepflow = new InMemoryStepflow();
        router = stepflow.signalRouter();
        approval = stepflow.register(TestWorkflows.linear("approval", "request", "ship"));
    }

    private Execution waitingForApproval() {
        Execution execution = stepflow.store.createExecution(approval, null);
        ScriptedInvoker invoker = new ScriptedInvoker().script("request", NodeOutcome.suspend("approved"));
        Execution claimed = stepflow.store.claim("w1", LEASE).orElseThrow();
        Execution waiting = stepflow.engine(invoker).run(claimed, "w1");
        assertThat(waiting.status()).isEqualTo(ExecutionStatus.WAITING_SIGNAL);
        return waiting;
    }

    @Test
    @DisplayName("A matching signal resumes a waiting execution with its payload merged")
    void matchingSignalResumes() {
        Execution waiting = waitingForApproval();

        SignalRouter.Delivery delivery = router.deliver(waiting.executionId(), "approved",
            JsonNodeFactory.instance.objectNode().put("by", "alice"));

        assertThat(delivery.resumed()).isTrue();
        assertThat(delivery.signal().processed()).isFalse();
        assertThat(delivery.execution().status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(delivery.execution().awaitingSignalType()).isNull();
        assertThat(StateBlob.signal(delivery.execution().stateBlob(), "approved").get("by").asText())
            .isEqualTo("alice");
        assertThat(stepflow.signals.findById(delivery.signal().signalId()).orElseThrow().processed()).isTrue();
        assertThat(stepflow.store.claim("w2", LEASE)).isPresent();
    }

    @Test
    @DisplayName("A signal of another type is stored but does not resume")
    void otherTypeIsStoredOnly() {
        Execution waiting = waitingForApproval();

        SignalRouter.Delivery delivery = router.deliver(waiting.executionId(), "rejected", null);

        assertThat(delivery.resumed()).isFalse();
        assertThat(delivery.execution().status()).isEqualTo(ExecutionStatus.WAITING_SIGNAL);
        assertThat(stepflow.signals.findByExecution(waiting.executionId()))
            .extracting(Signal::signalType).containsExactly("rejected");
        assertThat(stepflow.store.claim("w2", LEASE)).isEmpty();
    }

    @Test
    @DisplayName("Concurrent deliveries of the awaited type resume the execution exactly once")
    void concurrentDeliveriesResumeOnce() throws Exception {
        Execution waiting = waitingForApproval();
        int senders = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(senders);
        List<Future<SignalRouter.Delivery>> futures = new ArrayList<>();
        for (int i = 0; i < senders; i++) {
            int n = i;
            Callable<SignalRouter.Delivery> send = () -> {
                start.await();
                return router.deliver(waiting.executionId(), "approved",
                    JsonNodeFactory.instance.objectNode().put("sender", n));
            };
            futures.add(pool.submit(send));
        }
        start.countDown();

        int resumed = 0;
        for (Future<SignalRouter.Delivery> f : futures) {
            if (f.get(30, TimeUnit.SECONDS).resumed()) {
                resumed++;
            }
        }
        pool.shutdown();

        assertThat(resumed).isEqualTo(1);
        List<Signal> recorded = stepflow.signals.findByExecution(waiting.executionId());
        assertThat(recorded).hasSize(senders);
        assertThat(recorded).filteredOn(Signal::processed).hasSize(1);
        assertThat(stepflow.meterRegistry.find(ExecutionMetrics.SIGNALS).tag("resumed", "true").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Signals for a leased execution are left for the lease holder")
    void leasedExecutionIsNotResumed() {
        Execution waiting = waitingForApproval();
        Signal early = stepflow.signals.record(Signal.create(waiting.executionId(), "approved", null,
            stepflow.clock.instant()));
        stepflow.store.claim("w2", LEASE).orElseThrow();

        SignalRouter.Delivery delivery = router.deliver(waiting.executionId(), "approved", null);

        assertThat(delivery.resumed()).isFalse();
        assertThat(stepflow.signals.findOldestUnprocessed(waiting.executionId(), "approved"))
            .map(Signal::signalId).contains(early.signalId());
        assertThat(stepflow.signals.findByExecution(waiting.executionId())).hasSize(2);
    }

    @Test
    @DisplayName("Delivery to a terminal execution is rejected")
    void terminalExecutionRejects() {
        Execution execution = stepflow.store.createExecution(approval, null);
        stepflow.store.requestCancellation(execution.executionId(), null);

        assertThatThrownBy(() -> router.deliver(execution.executionId(), "approved", null))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(stepflow.signals.findByExecution(execution.executionId())).isEmpty();
    }

    @Test
    @DisplayName("Delivery to an unknown execution or with a blank type is rejected")
    void invalidDeliveriesRejected() {
        assertThatThrownBy(() -> router.deliver("missing", "approved", null))
            .isInstanceOf(NotFoundException.class);

        Execution waiting = waitingForApproval();
        assertThatThrownBy(() -> router.deliver(waiting.executionId(), " ", null))
            .isInstanceOf(WorkflowValidationException.class);
    }
}
