package io.github.drompincen.tapbridge.runtime.session;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.runtime.registry.ConnectionRegistry;
import io.github.drompincen.tapbridge.runtime.registry.MachineEventListener;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Feeds the demultiplexed machine streams of the registry into the session store.
 */
@Component
public class SessionEventFeed implements MachineEventListener {

    private final ConnectionRegistry registry;
    private final SessionEventStore store;

    public SessionEventFeed(ConnectionRegistry registry, SessionEventStore store) {
        this.registry = registry;
        this.store = store;
    }

    @PostConstruct
    void register() {
        registry.addListener(this);
    }

    @Override
    public void onEvent(BridgeEvent event) {
        store.accept(event);
    }

    @Override
    public void onMachineStatus(String machineId, ConnectionStatus status) {
        if (status != ConnectionStatus.CONNECTED) {
            store.discardBuffered(machineId);
        }
    }

    @Override
    public void onSessionsListed(String machineId, List<SessionInfo> sessions) {
        store.setSessionsForMachine(machineId, sessions);
    }

    @Override
    public void onHistoryComplete(String machineId, String sessionId) {
        if (sessionId != null) {
            store.completeHistoryLoading(sessionId);
        }
    }
}
