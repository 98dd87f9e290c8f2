package io.github.drompincen.tapbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One entry of a machine's session listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionInfo(
        String id,
        String agent,
        String machineId,
        String projectPath,
        String projectName,
        String status,
        String sessionName,
        Instant lastActivity,
        Instant createdAt
) {}
