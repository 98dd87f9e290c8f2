package io.github.drompincen.tapbridge.runtime.approval;

/**
 * Told about every approval request that is still pending after policy evaluation.
 */
public interface NotificationDispatcher {
    void approvalPending(String sessionId, String requestId);
}
