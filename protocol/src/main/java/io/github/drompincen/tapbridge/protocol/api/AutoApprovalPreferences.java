package io.github.drompincen.tapbridge.protocol.api;

public record AutoApprovalPreferences(
        boolean autoApproveLow,
        boolean autoApproveMedium,
        boolean autoApproveHigh,
        boolean autoApproveCritical
) {
    public static AutoApprovalPreferences none() {
        return new AutoApprovalPreferences(false, false, false, false);
    }
}
