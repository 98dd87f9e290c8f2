package io.github.drompincen.tapbridge.protocol.ws;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.event.EventKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.SUBSCRIBED, "sess-1", new TextNode("payload"));

        assertThat(msg.type()).isEqualTo(WsMessageType.SUBSCRIBED);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
        assertThat(msg.payload().asText()).isEqualTo("payload");
        assertThat(msg.ts()).isNotNull();
    }

    @Test
    void errorFactoryCarriesMessage() {
        WsMessage msg = WsMessage.error("sess-1", "machine not connected");

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
        assertThat(msg.payload().path("message").asText()).isEqualTo("machine not connected");
    }

    @Test
    void eventWrapsBridgeEventWithItsOwnTimestamp() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("delta", "hi");
        Instant at = Instant.parse("2026-01-01T10:00:00Z");

        WsMessage msg = WsMessage.event(new BridgeEvent("m1", "sess-1", EventKind.MESSAGE_DELTA, 7, payload, at));

        assertThat(msg.type()).isEqualTo(WsMessageType.EVENT);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
        assertThat(msg.ts()).isEqualTo(at);
        assertThat(msg.payload().path("kind").asText()).isEqualTo("MESSAGE_DELTA");
        assertThat(msg.payload().path("machineId").asText()).isEqualTo("m1");
        assertThat(msg.payload().path("seq").asLong()).isEqualTo(7);
        assertThat(msg.payload().path("event").path("delta").asText()).isEqualTo("hi");
    }

    @Test
    void approvalPendingNamesRequestAndSession() {
        WsMessage msg = WsMessage.approvalPending("sess-1", "r1");

        assertThat(msg.type()).isEqualTo(WsMessageType.APPROVAL_PENDING);
        assertThat(msg.payload().path("requestId").asText()).isEqualTo("r1");
        assertThat(msg.payload().path("sessionId").asText()).isEqualTo("sess-1");
    }

    @Test
    void statusIsBridgeWide() {
        assertThat(WsMessage.status(new TextNode("snapshot")).sessionId()).isNull();
        assertThat(WsMessage.subscribed("sess-1").type()).isEqualTo(WsMessageType.SUBSCRIBED);
        assertThat(WsMessage.unsubscribed("sess-1").payload()).isNull();
    }

    @Test
    void wsMessageTypesIncludeClientAndServerTypes() {
        assertThat(WsMessageType.valueOf("SUBSCRIBE_SESSION")).isNotNull();
        assertThat(WsMessageType.valueOf("APPROVE_TOOL_CALL")).isNotNull();
        assertThat(WsMessageType.valueOf("EVENT")).isNotNull();
        assertThat(WsMessageType.valueOf("APPROVAL_PENDING")).isNotNull();
        assertThat(WsMessageType.valueOf("ERROR")).isNotNull();
    }
}
