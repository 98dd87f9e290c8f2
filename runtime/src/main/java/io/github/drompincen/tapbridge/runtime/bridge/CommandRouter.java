package io.github.drompincen.tapbridge.runtime.bridge;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnection;
import io.github.drompincen.tapbridge.runtime.registry.ConnectionRegistry;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget delivery of client messages to the connection that owns a machine.
 */
@Component
public class CommandRouter {

    private final ConnectionRegistry registry;

    public CommandRouter(ConnectionRegistry registry) {
        this.registry = registry;
    }

    public boolean isConnected(String machineId) {
        return registry.machineStatus(machineId) == ConnectionStatus.CONNECTED;
    }

    /**
     * @throws NotConnectedException if the machine is not connected or its socket refused the message
     */
    public void send(String machineId, ClientMessage message) {
        if (!isConnected(machineId)) {
            throw new NotConnectedException(machineId);
        }
        MachineConnection connection = registry.connection(machineId)
                .orElseThrow(() -> new NotConnectedException(machineId));
        if (!connection.send(message)) {
            throw new NotConnectedException(machineId);
        }
    }
}
