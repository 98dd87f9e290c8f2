package io.github.drompincen.tapbridge.runtime.connection;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;

import java.util.List;

public interface MachineConnectionListener {
    void onStatusChange(String machineId, ConnectionStatus status);
    default void onSessionsListed(String machineId, List<SessionInfo> sessions) {}
    default void onHistoryComplete(String machineId, String sessionId) {}
    default void onError(String machineId, String message) {}
}
