package io.github.drompincen.tapbridge.protocol.api;

public enum ApprovalState {
    PENDING,
    APPROVED,
    DENIED,
    AUTO_APPROVED,
    AUTO_DENIED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
