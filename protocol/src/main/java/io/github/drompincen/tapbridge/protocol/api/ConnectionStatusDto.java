package io.github.drompincen.tapbridge.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ConnectionStatusDto(
        ConnectionStatus status,
        Map<String, ConnectionStatus> machines,
        String error,
        Instant lastConnected
) {}
