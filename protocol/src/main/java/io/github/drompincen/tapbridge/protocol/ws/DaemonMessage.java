package io.github.drompincen.tapbridge.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

public record DaemonMessage(
        DaemonMessageType type,
        JsonNode body
) {
    public static DaemonMessage of(JsonNode body) {
        return new DaemonMessage(DaemonMessageType.fromWire(body.path("type").asText(null)), body);
    }

    public String text(String field) {
        JsonNode node = body.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
