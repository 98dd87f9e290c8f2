package io.github.drompincen.tapbridge.runtime.approval;

import io.github.drompincen.tapbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.tapbridge.protocol.api.ApprovalState;
import io.github.drompincen.tapbridge.protocol.api.RiskTier;

import java.time.Instant;

/**
 * A sensitive agent action awaiting a decision.
 * <p>
 * Resolution happens at most once. {@link #resolve} runs the decision's side effect and the
 * state change inside one exclusive section, so a human decision racing the auto-policy sends
 * exactly one command; the loser gets {@code false} and does nothing.
 */
public class ApprovalRequest {

    private final String requestId;
    private final String toolCallId;
    private final String sessionId;
    private final String machineId;
    private final RiskTier riskTier;
    private final ApprovalPayload payload;
    private final Instant createdAt;
    private final long arrivalSeq;

    private ApprovalState state = ApprovalState.PENDING;
    private Instant resolvedAt;
    private ToolOutcome outcome;
    private volatile boolean exposed;

    public ApprovalRequest(String requestId, String toolCallId, String sessionId, String machineId,
                           RiskTier riskTier, ApprovalPayload payload, Instant createdAt, long arrivalSeq) {
        this.requestId = requestId;
        this.toolCallId = toolCallId;
        this.sessionId = sessionId;
        this.machineId = machineId;
        this.riskTier = riskTier;
        this.payload = payload;
        this.createdAt = createdAt;
        this.arrivalSeq = arrivalSeq;
    }

    /**
     * Moves a pending request to {@code terminal}, running {@code dispatch} first.
     * If {@code dispatch} throws, the request stays pending and the exception propagates.
     *
     * @return false if the request was already resolved; nothing is dispatched then
     */
    public synchronized boolean resolve(ApprovalState terminal, Runnable dispatch) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (state != ApprovalState.PENDING) {
            return false;
        }
        dispatch.run();
        state = terminal;
        resolvedAt = Instant.now();
        return true;
    }

    /**
     * Attaches the tool's outcome; only resolved requests accept one.
     */
    public synchronized boolean attachOutcome(ToolOutcome toolOutcome) {
        if (state == ApprovalState.PENDING) {
            return false;
        }
        outcome = toolOutcome;
        return true;
    }

    /** Marks the request visible for human decision; set once policy evaluation is done. */
    public void expose() {
        exposed = true;
    }

    public boolean isExposed() {
        return exposed;
    }

    public boolean isPending() {
        return state() == ApprovalState.PENDING;
    }

    public synchronized ApprovalState state() {
        return state;
    }

    public synchronized Instant resolvedAt() {
        return resolvedAt;
    }

    public synchronized ToolOutcome outcome() {
        return outcome;
    }

    public String requestId() {
        return requestId;
    }

    public String toolCallId() {
        return toolCallId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String machineId() {
        return machineId;
    }

    public RiskTier riskTier() {
        return riskTier;
    }

    public ApprovalPayload payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public long arrivalSeq() {
        return arrivalSeq;
    }

    public synchronized ApprovalRequestDto toDto() {
        return new ApprovalRequestDto(requestId, toolCallId, sessionId, machineId,
                payload.toolName(), payload.description(), payload.toolInput(), payload.preview(),
                riskTier, state, createdAt, resolvedAt);
    }
}
