package io.github.drompincen.tapbridge.runtime.registry;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;

import java.util.Collection;

/**
 * Derives the single connectivity indicator from every per-machine state.
 * Strict priority, independent of counts: connected, then connecting, then error.
 */
public final class AggregateStatusReducer {

    private AggregateStatusReducer() {
    }

    public static ConnectionStatus derive(Collection<ConnectionStatus> machineStates) {
        boolean connecting = false;
        boolean error = false;
        for (ConnectionStatus state : machineStates) {
            if (state == ConnectionStatus.CONNECTED) {
                return ConnectionStatus.CONNECTED;
            }
            connecting |= state == ConnectionStatus.CONNECTING;
            error |= state == ConnectionStatus.ERROR;
        }
        if (connecting) {
            return ConnectionStatus.CONNECTING;
        }
        return error ? ConnectionStatus.ERROR : ConnectionStatus.DISCONNECTED;
    }
}
