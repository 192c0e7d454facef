package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Node types available without application code.
 */
public final class BuiltinActivityHandlers {

    /** Outputs the node's config unchanged. */
    public static final String PASS = "pass";

    /** Waits for the signal named by {@code config.signalType}, then outputs its payload. */
    public static final String AWAIT_SIGNAL = "await-signal";

    /** Fails with {@code config.errorCode}; retryable unless {@code config.retryable} is false. */
    public static final String FAIL = "fail";

    private BuiltinActivityHandlers() {
    }

    public static void registerAll(HandlerRegistryActivityInvoker invoker) {
        invoker.register(PASS, ActivityContext::getConfig);
        invoker.register(AWAIT_SIGNAL, BuiltinActivityHandlers::awaitSignal);
        invoker.register(FAIL, BuiltinActivityHandlers::fail);
    }

    static JsonNode awaitSignal(ActivityContext context) throws ActivityException {
        String signalType = context.getConfig().path("signalType").asText("");
        if (signalType.isBlank()) {
            throw ActivityException.fatal("MISSING_CONFIG", "config.signalType is required");
        }
        JsonNode payload = context.getReceivedSignal();
        if (payload == null) {
            context.awaitSignal(signalType);
            return null;
        }
        return payload;
    }

    static JsonNode fail(ActivityContext context) throws ActivityException {
        JsonNode config = context.getConfig();
        String errorCode = config.path("errorCode").asText("FAILED");
        String message = config.path("message").asText("Node " + context.getNodeId() + " failed");
        throw new ActivityException(errorCode, message, config.path("retryable").asBoolean(true));
    }
}
