package io.github.drompincen.tapbridge.protocol.api;

import java.time.Instant;

public record MessageDto(
        String messageId,
        String sessionId,
        String role,
        String content,
        boolean partial,
        Instant timestamp
) {}
