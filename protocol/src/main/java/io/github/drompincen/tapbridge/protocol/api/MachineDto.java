package io.github.drompincen.tapbridge.protocol.api;

public record MachineDto(
        String id,
        String name,
        boolean online,
        String tunnelUrl
) {
    /** Online and reachable through a tunnel. */
    public boolean isConnectable() {
        return online && tunnelUrl != null && !tunnelUrl.isBlank();
    }
}
