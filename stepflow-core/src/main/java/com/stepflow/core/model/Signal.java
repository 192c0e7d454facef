package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * External event addressed to one execution.
 * Consumed at most once: {@code processed} flips together with the execution resume.
 */
public record Signal(
    String signalId,
    String executionId,
    String signalType,
    JsonNode payload,
    Instant receivedAt,
    boolean processed,
    Instant processedAt
) {
    public static Signal create(String executionId, String signalType, JsonNode payload, Instant now) {
        return new Signal(
            UUID.randomUUID().toString(),
            executionId,
            signalType,
            payload,
            now,
            false,
            null
        );
    }

    public Signal markProcessed(Instant at) {
        return new Signal(signalId, executionId, signalType, payload, receivedAt, true, at);
    }
}
