package io.github.drompincen.tapbridge.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Messages the bridge sends to a machine daemon.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientMessage(
        String type,
        String token,
        String sessionId,
        List<String> sessionIds,
        AgentCommand command
) {
    public static ClientMessage auth(String token) {
        return new ClientMessage("auth", token, null, null, null);
    }

    public static ClientMessage ping() {
        return new ClientMessage("ping", null, null, null, null);
    }

    public static ClientMessage subscribe(List<String> sessionIds) {
        return new ClientMessage("subscribe", null, null, sessionIds, null);
    }

    public static ClientMessage unsubscribe(List<String> sessionIds) {
        return new ClientMessage("unsubscribe", null, null, sessionIds, null);
    }

    public static ClientMessage command(String sessionId, AgentCommand command) {
        return new ClientMessage("command", null, sessionId, null, command);
    }

    public static ClientMessage terminateSession(String sessionId) {
        return new ClientMessage("terminate_session", null, sessionId, null, null);
    }
}
