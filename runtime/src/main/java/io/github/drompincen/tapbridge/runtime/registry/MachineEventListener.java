package io.github.drompincen.tapbridge.runtime.registry;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;

import java.util.List;

public interface MachineEventListener {
    void onEvent(BridgeEvent event);
    default void onMachineStatus(String machineId, ConnectionStatus status) {}
    default void onSessionsListed(String machineId, List<SessionInfo> sessions) {}
    default void onHistoryComplete(String machineId, String sessionId) {}
}
