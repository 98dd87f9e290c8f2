package io.github.drompincen.tapbridge.runtime.session;

import io.github.drompincen.tapbridge.protocol.api.MessageDto;

import java.time.Instant;

record TranscriptMessage(
        String messageId,
        String role,
        String content,
        boolean partial,
        Instant timestamp
) {
    TranscriptMessage append(String delta, Instant at) {
        return new TranscriptMessage(messageId, role, content + delta, true, at);
    }

    MessageDto toDto(String sessionId) {
        return new MessageDto(messageId, sessionId, role, content, partial, timestamp);
    }
}
