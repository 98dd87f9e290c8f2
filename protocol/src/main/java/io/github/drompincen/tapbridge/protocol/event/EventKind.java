package io.github.drompincen.tapbridge.protocol.event;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized kinds of inbound session events, keyed by the agent event types that map onto them.
 */
public enum EventKind {
    MESSAGE_DELTA("message:delta"),
    MESSAGE_COMPLETE("message:complete"),
    TOOL_CALL("approval:requested"),
    TOOL_RESULT("tool:result", "tool:error"),
    APPROVAL_RESOLVED("approval:resolved"),
    SESSION_STATUS("session:status_changed"),
    SESSION_END("session:completed", "session:error");

    private static final Map<String, EventKind> BY_WIRE_TYPE = new HashMap<>();

    static {
        for (EventKind kind : values()) {
            for (String wireType : kind.wireTypes) {
                BY_WIRE_TYPE.put(wireType, kind);
            }
        }
    }

    private final List<String> wireTypes;

    EventKind(String... wireTypes) {
        this.wireTypes = List.of(wireTypes);
    }

    public List<String> wireTypes() {
        return wireTypes;
    }

    public static Optional<EventKind> fromWire(String wireType) {
        if (wireType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_TYPE.get(wireType));
    }
}
