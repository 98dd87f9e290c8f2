package io.github.drompincen.tapbridge.protocol.ws;

public enum WsMessageType {
    // Presentation client -> bridge
    SUBSCRIBE_SESSION,
    UNSUBSCRIBE,
    SEND_MESSAGE,
    APPROVE_TOOL_CALL,
    DENY_TOOL_CALL,
    CANCEL_SESSION,

    // Bridge -> presentation client
    EVENT,
    APPROVAL_PENDING,
    STATUS,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
