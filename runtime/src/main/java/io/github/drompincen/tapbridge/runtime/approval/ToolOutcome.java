package io.github.drompincen.tapbridge.runtime.approval;

import java.time.Instant;

public record ToolOutcome(
        String output,
        String error,
        Instant completedAt
) {
    public boolean failed() {
        return error != null;
    }
}
