package io.github.drompincen.tapbridge.runtime.bridge;

public class UnknownApprovalRequestException extends RuntimeException {

    public UnknownApprovalRequestException(String requestId) {
        super("Unknown approval request " + requestId);
    }
}
