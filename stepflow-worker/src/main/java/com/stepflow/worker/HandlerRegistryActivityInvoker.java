package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.activity.ActivityInvoker;
import com.stepflow.core.activity.ActivityRequest;
import com.stepflow.core.model.NodeDefinition;
import com.stepflow.core.model.NodeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes nodes by dispatching on their type tag to registered handlers.
 *
 * Each invocation runs on a separate thread so a node that overruns its
 * timeout (the node's own, or the configured default) can be abandoned and
 * reported as a retryable failure. While a handler runs, the caller's lease is
 * renewed every heartbeat interval; if a renewal fails the invocation is
 * abandoned. Handler exceptions never escape: an
 * {@link ActivityException} keeps its code and retryability, anything else
 * is treated as retryable.
 */
public class HandlerRegistryActivityInvoker implements ActivityInvoker {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistryActivityInvoker.class);

    public static final String UNKNOWN_NODE_TYPE = "UNKNOWN_NODE_TYPE";
    public static final String NODE_TIMEOUT = "NODE_TIMEOUT";
    public static final String ACTIVITY_ERROR = "ACTIVITY_ERROR";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String LEASE_LOST = "LEASE_LOST";

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(10);

    private final Map<String, ActivityHandler> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;
    private final Duration heartbeatInterval;
    private final ExecutorService executor;

    public HandlerRegistryActivityInvoker(ObjectMapper objectMapper, Duration defaultTimeout) {
        this(objectMapper, defaultTimeout, DEFAULT_HEARTBEAT_INTERVAL);
    }

    /**
     * @param heartbeatInterval how often the lease is renewed while a handler runs;
     *                          must be well below the lease duration
     */
    public HandlerRegistryActivityInvoker(ObjectMapper objectMapper, Duration defaultTimeout,
                                          Duration heartbeatInterval) {
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        this.objectMapper = objectMapper;
        this.defaultTimeout = defaultTimeout;
        this.heartbeatInterval = heartbeatInterval;
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "stepflow-activity-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register the handler for a node type, replacing any previous one.
     */
    public HandlerRegistryActivityInvoker register(String nodeType, ActivityHandler handler) {
        handlers.put(nodeType, handler);
        log.info("Registered activity handler for node type {}", nodeType);
        return this;
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public NodeOutcome invoke(ActivityRequest request) {
        NodeDefinition node = request.node();
        ActivityHandler handler = handlers.get(node.type());
        if (handler == null) {
            return NodeOutcome.fatal(UNKNOWN_NODE_TYPE, "No handler registered for node type " + node.type());
        }

        ActivityContext context = new ActivityContext(request, objectMapper);
        Duration timeout = node.timeout() != null ? node.timeout() : defaultTimeout;
        Future<JsonNode> future = executor.submit(() -> handler.execute(context));
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    future.cancel(true);
                    log.warn("Node {} of execution {} timed out after {}", node.nodeId(), request.executionId(), timeout);
                    return NodeOutcome.retryable(NODE_TIMEOUT, "Node " + node.nodeId() + " timed out after " + timeout);
                }
                try {
                    JsonNode output = future.get(Math.min(remaining, heartbeatInterval.toNanos()), TimeUnit.NANOSECONDS);
                    return toOutcome(context, output);
                } catch (TimeoutException e) {
                    if (!context.heartbeat()) {
                        future.cancel(true);
                        log.warn("Lease on execution {} lost while node {} was running", request.executionId(),
                            node.nodeId());
                        return NodeOutcome.retryable(LEASE_LOST, "Lease lost while node " + node.nodeId() + " was running");
                    }
                }
            }
        } catch (ExecutionException e) {
            return failureOutcome(node, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return NodeOutcome.retryable(INTERRUPTED, "Invocation of node " + node.nodeId() + " was interrupted");
        }
    }

    private static NodeOutcome toOutcome(ActivityContext context, JsonNode output) {
        if (context.awaitedSignalType() != null) {
            return NodeOutcome.suspend(context.awaitedSignalType());
        }
        if (context.nextNodeId() != null) {
            return NodeOutcome.successTo(output, context.nextNodeId());
        }
        return NodeOutcome.success(output);
    }

    private static NodeOutcome failureOutcome(NodeDefinition node, Throwable cause) {
        if (cause instanceof ActivityException) {
            ActivityException failure = (ActivityException) cause;
            log.info("Node {} failed with {} (retryable: {})", node.nodeId(), failure.getErrorCode(),
                failure.isRetryable());
            return failure.isRetryable()
                ? NodeOutcome.retryable(failure.getErrorCode(), failure.getMessage())
                : NodeOutcome.fatal(failure.getErrorCode(), failure.getMessage());
        }
        log.warn("Node {} threw an unexpected exception", node.nodeId(), cause);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return NodeOutcome.retryable(ACTIVITY_ERROR, detail);
    }

    /**
     * Stop the invocation threads. Running handlers are interrupted.
     */
    public void shutdown() {
        executor.shutdownNow();
    }
}
