package io.github.drompincen.tapbridge.runtime.bridge;

/**
 * A command targeted a machine that is not currently connected. Nothing was sent and the
 * bridge does not retry; the caller decides whether to try again after reconnection.
 */
public class NotConnectedException extends RuntimeException {

    private final String machineId;

    public NotConnectedException(String machineId) {
        super("Machine " + machineId + " is not connected");
        this.machineId = machineId;
    }

    public String getMachineId() {
        return machineId;
    }
}
