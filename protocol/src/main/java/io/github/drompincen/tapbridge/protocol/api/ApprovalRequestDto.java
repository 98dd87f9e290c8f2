package io.github.drompincen.tapbridge.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ApprovalRequestDto(
        String requestId,
        String toolCallId,
        String sessionId,
        String machineId,
        String toolName,
        String description,
        JsonNode toolInput,
        String preview,
        RiskTier riskTier,
        ApprovalState state,
        Instant createdAt,
        Instant resolvedAt
) {}
