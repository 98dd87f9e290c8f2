package io.github.drompincen.tapbridge.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record BridgeEvent(
        String machineId,
        String sessionId,
        EventKind kind,
        long seq,
        JsonNode payload,
        Instant timestamp
) {}
