package io.github.drompincen.tapbridge.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;

import java.time.Instant;

/**
 * Envelope exchanged with presentation clients over {@code /ws}.
 * {@code sessionId} is null for messages that concern the whole bridge.
 */
public record WsMessage(
        WsMessageType type,
        String sessionId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String sessionId, JsonNode payload) {
        return new WsMessage(type, sessionId, payload, Instant.now());
    }

    /**
     * A session event as pushed to subscribers; {@code ts} is the time the agent produced it.
     */
    public static WsMessage event(BridgeEvent event) {
        ObjectNode body = JsonNodeFactory.instance.objectNode()
                .put("machineId", event.machineId())
                .put("kind", event.kind().name())
                .put("seq", event.seq());
        body.set("event", event.payload());
        return new WsMessage(WsMessageType.EVENT, event.sessionId(), body, event.timestamp());
    }

    public static WsMessage subscribed(String sessionId) {
        return of(WsMessageType.SUBSCRIBED, sessionId, null);
    }

    public static WsMessage unsubscribed(String sessionId) {
        return of(WsMessageType.UNSUBSCRIBED, sessionId, null);
    }

    public static WsMessage approvalPending(String sessionId, String requestId) {
        return of(WsMessageType.APPROVAL_PENDING, sessionId,
                JsonNodeFactory.instance.objectNode().put("requestId", requestId).put("sessionId", sessionId));
    }

    public static WsMessage status(JsonNode snapshot) {
        return of(WsMessageType.STATUS, null, snapshot);
    }

    public static WsMessage error(String sessionId, String message) {
        return of(WsMessageType.ERROR, sessionId, JsonNodeFactory.instance.objectNode().put("message", message));
    }
}
