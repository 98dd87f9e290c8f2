package io.github.drompincen.tapbridge.runtime.connection;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import reactor.core.publisher.Flux;

/**
 * One transport connection to one machine.
 * <p>
 * Failures (malformed endpoint, refused connection, abrupt close) surface as status
 * transitions on the {@link MachineConnectionListener}; none of these methods throw for them.
 */
public interface MachineConnection {

    String machineId();

    ConnectionStatus status();

    void connect();

    void disconnect();

    /**
     * Sends a message if the socket is open.
     *
     * @return false when the message could not be handed to the transport
     */
    boolean send(ClientMessage message);

    /**
     * Inbound events of the current connection attempt, tagged with this machine's id.
     * Completes on disconnect; the next {@link #connect()} starts a fresh sequence.
     */
    Flux<BridgeEvent> events();
}
