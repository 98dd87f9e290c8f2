package io.github.drompincen.tapbridge.runtime.registry;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnection;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnectionListener;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory connection whose transitions are driven by the test.
 */
class FakeMachineConnection implements MachineConnection {

    final String machineId;
    final MachineConnectionListener listener;
    final Sinks.Many<BridgeEvent> sink = Sinks.many().multicast().directBestEffort();
    final List<ClientMessage> sent = new ArrayList<>();
    ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    int connectCalls;
    int disconnectCalls;

    FakeMachineConnection(String machineId, MachineConnectionListener listener) {
        this.machineId = machineId;
        this.listener = listener;
    }

    void moveTo(ConnectionStatus next) {
        status = next;
        listener.onStatusChange(machineId, next);
    }

    @Override
    public String machineId() {
        return machineId;
    }

    @Override
    public ConnectionStatus status() {
        return status;
    }

    @Override
    public void connect() {
        connectCalls++;
        moveTo(ConnectionStatus.CONNECTING);
    }

    @Override
    public void disconnect() {
        disconnectCalls++;
        status = ConnectionStatus.DISCONNECTED;
        sink.tryEmitComplete();
    }

    @Override
    public boolean send(ClientMessage message) {
        sent.add(message);
        return status == ConnectionStatus.CONNECTED;
    }

    @Override
    public Flux<BridgeEvent> events() {
        return sink.asFlux();
    }
}
