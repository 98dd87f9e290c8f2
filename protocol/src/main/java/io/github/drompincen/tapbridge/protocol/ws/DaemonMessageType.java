package io.github.drompincen.tapbridge.protocol.ws;

import java.util.Arrays;

/**
 * Message types a machine daemon sends to the bridge.
 */
public enum DaemonMessageType {
    AUTH_SUCCESS("auth_success"),
    AUTH_ERROR("auth_error"),
    SESSIONS_LIST("sessions_list"),
    ACP_EVENT("acp_event"),
    HISTORY_COMPLETE("history_complete"),
    ERROR("error"),
    PONG("pong"),
    UNKNOWN("");

    private final String wireName;

    DaemonMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DaemonMessageType fromWire(String wireName) {
        if (wireName == null || wireName.isEmpty()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
