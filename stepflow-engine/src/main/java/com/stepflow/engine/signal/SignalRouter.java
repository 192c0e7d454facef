package com.stepflow.engine.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowValidationException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.Signal;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Delivers external signals to executions.
 *
 * A signal is always recorded first. If its execution is already waiting for
 * that type and no worker holds it, the router resumes it on the spot;
 * otherwise the signal stays unprocessed and the execution consumes it once
 * it suspends on that type. Resume is a single store transaction, so
 * concurrent deliveries of the same type resume an execution exactly once.
 */
public class SignalRouter {

    private static final Logger log = LoggerFactory.getLogger(SignalRouter.class);

    private final ExecutionStore store;
    private final SignalRepository signalRepository;
    private final ExecutionMetrics metrics;
    private final Clock clock;

    public SignalRouter(ExecutionStore store, SignalRepository signalRepository,
                        ExecutionMetrics metrics, Clock clock) {
        this.store = store;
        this.signalRepository = signalRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Deliver a signal.
     *
     * @param executionId target execution
     * @param signalType signal type matched against the awaited type
     * @param payload merged into the state blob under {@code signals.<type>}
     * @return the outcome of the delivery
     * @throws NotFoundException if the execution does not exist
     * @throws InvalidStateTransitionException if the execution is terminal
     */
    public Delivery deliver(String executionId, String signalType, JsonNode payload) {
        if (signalType == null || signalType.isBlank()) {
            throw new WorkflowValidationException("signalType", "must not be blank");
        }
        Execution execution = store.findById(executionId)
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
        if (execution.isTerminal()) {
            throw new InvalidStateTransitionException(executionId, execution.status(), "signal");
        }

        Signal signal = signalRepository.record(Signal.create(executionId, signalType, payload, clock.instant()));
        log.info("Recorded signal {} of type {} for execution {}", signal.signalId(), signalType, executionId);

        Optional<Execution> resumed = Optional.empty();
        if (execution.status() == ExecutionStatus.WAITING_SIGNAL
                && signalType.equals(execution.awaitingSignalType())) {
            resumed = signalRepository.resumeWithSignal(signal.signalId(), null);
        }

        metrics.signalReceived(signalType, resumed.isPresent());
        if (resumed.isPresent()) {
            log.info("Signal {} resumed execution {}", signal.signalId(), executionId);
            return new Delivery(signal, true, resumed.get());
        }
        return new Delivery(signal, false, store.findById(executionId).orElse(execution));
    }

    /**
     * Result of a delivery.
     *
     * @param signal the recorded signal
     * @param resumed whether this delivery resumed the execution
     * @param execution the execution after the delivery
     */
    public record Delivery(Signal signal, boolean resumed, Execution execution) {}
}
