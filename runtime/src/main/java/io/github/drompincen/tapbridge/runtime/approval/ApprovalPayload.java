package io.github.drompincen.tapbridge.runtime.approval;

import com.fasterxml.jackson.databind.JsonNode;

public record ApprovalPayload(
        String toolName,
        String description,
        JsonNode toolInput,
        String preview
) {}
