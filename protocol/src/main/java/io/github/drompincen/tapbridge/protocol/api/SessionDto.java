package io.github.drompincen.tapbridge.protocol.api;

import java.time.Instant;

public record SessionDto(
        String sessionId,
        String machineId,
        String agent,
        String projectName,
        String sessionName,
        String status,
        String lastMessage,
        boolean loadingHistory,
        boolean historyLoaded,
        boolean ended,
        int messageCount,
        Instant lastActivity
) {}
