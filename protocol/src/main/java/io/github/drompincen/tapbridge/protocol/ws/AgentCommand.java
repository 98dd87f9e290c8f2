package io.github.drompincen.tapbridge.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentCommand(
        String command,
        String message,
        String requestId,
        String toolCallId,
        String reason
) {
    public static AgentCommand sendMessage(String message) {
        return new AgentCommand("send_message", message, null, null, null);
    }

    public static AgentCommand approveToolCall(String requestId, String toolCallId) {
        return new AgentCommand("approve_tool_call", null, requestId, toolCallId, null);
    }

    public static AgentCommand denyToolCall(String requestId, String toolCallId, String reason) {
        return new AgentCommand("deny_tool_call", null, requestId, toolCallId, reason);
    }
}
