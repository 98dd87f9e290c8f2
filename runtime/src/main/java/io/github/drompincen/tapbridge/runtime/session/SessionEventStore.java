package io.github.drompincen.tapbridge.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.tapbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.tapbridge.protocol.api.ApprovalState;
import io.github.drompincen.tapbridge.protocol.api.MessageDto;
import io.github.drompincen.tapbridge.protocol.api.RiskTier;
import io.github.drompincen.tapbridge.protocol.api.SessionDto;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.event.EventKind;
import io.github.drompincen.tapbridge.protocol.ws.AgentCommand;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.runtime.approval.ApprovalPayload;
import io.github.drompincen.tapbridge.runtime.approval.ApprovalPolicyEngine;
import io.github.drompincen.tapbridge.runtime.approval.ApprovalRequest;
import io.github.drompincen.tapbridge.runtime.approval.NotificationDispatcher;
import io.github.drompincen.tapbridge.runtime.approval.PolicyDecision;
import io.github.drompincen.tapbridge.runtime.approval.PreferencesStore;
import io.github.drompincen.tapbridge.runtime.approval.ToolOutcome;
import io.github.drompincen.tapbridge.runtime.bridge.CommandRouter;
import io.github.drompincen.tapbridge.runtime.bridge.NotConnectedException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Per-session transcript, history buffering and the pending-approval queue.
 * <p>
 * Each session is mutated under its own monitor, so events for one session apply in arrival
 * order while different sessions proceed independently. A new approval request goes through
 * the policy engine before its {@code TOOL_CALL} event reaches subscribers, and only shows up
 * in {@link #pendingApprovals()} once the policy has declined to auto-approve it. The
 * notification dispatcher is called after the session monitor is released.
 */
@Service
public class SessionEventStore {

    private static final Logger log = LoggerFactory.getLogger(SessionEventStore.class);
    private static final int TITLE_LIMIT = 100;

    private final ApprovalPolicyEngine policyEngine;
    private final PreferencesStore preferencesStore;
    private final NotificationDispatcher notificationDispatcher;
    private final CommandRouter commandRouter;

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Map<String, ApprovalRequest> approvals = new ConcurrentHashMap<>();
    private final Map<String, String> requestIdsByToolCall = new ConcurrentHashMap<>();
    private final AtomicLong arrivals = new AtomicLong();

    public SessionEventStore(ApprovalPolicyEngine policyEngine, PreferencesStore preferencesStore,
                             NotificationDispatcher notificationDispatcher, CommandRouter commandRouter) {
        this.policyEngine = policyEngine;
        this.preferencesStore = preferencesStore;
        this.notificationDispatcher = notificationDispatcher;
        this.commandRouter = commandRouter;
    }

    // ---- inbound ----

    public void accept(BridgeEvent event) {
        SessionState state = sessions.computeIfAbsent(event.sessionId(),
                id -> new SessionState(id, event.machineId()));
        List<ApprovalRequest> awaitingHuman = new ArrayList<>();
        synchronized (state) {
            if (state.loadingHistory) {
                state.buffer.add(event);
                return;
            }
            applySafely(state, event, awaitingHuman);
        }
        awaitingHuman.forEach(this::notifyPending);
    }

    /**
     * Starts buffering the session's events until {@link #completeHistoryLoading}.
     *
     * @return false if history is already loading or loaded, in which case nothing changes
     */
    public boolean startHistoryLoading(String sessionId) {
        SessionState state = requireSession(sessionId);
        synchronized (state) {
            if (state.loadingHistory || state.historyLoaded) {
                return false;
            }
            state.loadingHistory = true;
            state.transcript.clear();
            return true;
        }
    }

    public void cancelHistoryLoading(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.buffer.clear();
            state.loadingHistory = false;
        }
    }

    /**
     * Applies everything buffered since {@link #startHistoryLoading} in arrival order.
     */
    public void completeHistoryLoading(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            log.debug("History completed for unknown session {}", sessionId);
            return;
        }
        List<ApprovalRequest> awaitingHuman = new ArrayList<>();
        synchronized (state) {
            if (!state.loadingHistory) {
                log.debug("Ignoring history completion for session {} which is not loading", sessionId);
                return;
            }
            for (BridgeEvent event : state.buffer) {
                applySafely(state, event, awaitingHuman);
            }
            log.debug("Session {} history loaded: {} events", sessionId, state.buffer.size());
            state.buffer.clear();
            state.loadingHistory = false;
            state.historyLoaded = true;
        }
        awaitingHuman.forEach(this::notifyPending);
    }

    /**
     * Drops buffered history for every session of a machine that left {@code CONNECTED}. History
     * is fetched again on the next subscription.
     */
    public void discardBuffered(String machineId) {
        for (SessionState state : sessions.values()) {
            synchronized (state) {
                if (machineId.equals(state.machineId) && (state.loadingHistory || state.historyLoaded)) {
                    log.debug("Discarding history state of session {} on machine {}", state.sessionId, machineId);
                    state.resetHistory();
                }
            }
        }
    }

    /**
     * Upserts a machine's session listing. Transcripts of known sessions are kept.
     */
    public void setSessionsForMachine(String machineId, List<SessionInfo> listing) {
        Set<String> seen = new HashSet<>();
        for (SessionInfo info : listing) {
            if (info.id() == null || !seen.add(info.id())) {
                continue;
            }
            SessionState state = sessions.computeIfAbsent(info.id(), id -> new SessionState(id, machineId));
            synchronized (state) {
                state.merge(machineId, info);
            }
        }
        log.debug("Machine {} lists {} sessions", machineId, seen.size());
    }

    public void clearSession(String sessionId) {
        SessionState state = sessions.remove(sessionId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            for (String requestId : state.requestIds) {
                ApprovalRequest request = approvals.remove(requestId);
                if (request != null) {
                    requestIdsByToolCall.remove(request.toolCallId());
                }
            }
            state.sink.tryEmitComplete();
        }
    }

    // ---- reads ----

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public List<SessionDto> sessions() {
        return sessions.values().stream()
                .map(this::snapshot)
                .sorted(Comparator.comparing(SessionDto::lastActivity,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public Optional<SessionDto> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(this::snapshot);
    }

    public List<MessageDto> messages(String sessionId) {
        SessionState state = requireSession(sessionId);
        synchronized (state) {
            return state.messages();
        }
    }

    public Optional<String> machineIdFor(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(state.machineId);
        }
    }

    public Optional<ApprovalRequest> approval(String requestId) {
        return Optional.ofNullable(approvals.get(requestId));
    }

    /**
     * Requests awaiting a human decision, oldest first.
     */
    public List<ApprovalRequestDto> pendingApprovals() {
        return pending(approvals.values());
    }

    public List<ApprovalRequestDto> pendingApprovals(String sessionId) {
        return pending(approvals.values().stream()
                .filter(r -> r.sessionId().equals(sessionId))
                .collect(Collectors.toList()));
    }

    /**
     * Live events of a session in arrival order, each subscriber with its own buffer.
     * An ended session yields an empty stream.
     */
    public Flux<BridgeEvent> events(String sessionId) {
        SessionState state = requireSession(sessionId);
        synchronized (state) {
            if (state.ended) {
                return Flux.empty();
            }
            return state.sink.asFlux()
                    .onBackpressureBuffer()
                    .publishOn(Schedulers.boundedElastic());
        }
    }

    private SessionDto snapshot(SessionState state) {
        synchronized (state) {
            return state.toDto();
        }
    }

    private SessionState requireSession(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new UnknownSessionException(sessionId);
        }
        return state;
    }

    private static List<ApprovalRequestDto> pending(Collection<ApprovalRequest> requests) {
        return requests.stream()
                .filter(r -> r.isExposed() && r.isPending())
                .sorted(Comparator.comparingLong(ApprovalRequest::arrivalSeq))
                .map(ApprovalRequest::toDto)
                .collect(Collectors.toList());
    }

    // ---- event application (caller holds the session monitor) ----

    private void applySafely(SessionState state, BridgeEvent event, List<ApprovalRequest> awaitingHuman) {
        List<ApprovalRequest> created = new ArrayList<>(1);
        try {
            apply(state, event, created);
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed {} event for session {}: {}", event.kind(), state.sessionId, e.getMessage());
            return;
        }
        for (ApprovalRequest request : created) {
            if (route(request)) {
                awaitingHuman.add(request);
            }
        }
        state.sink.tryEmitNext(event);
        if (event.kind() == EventKind.SESSION_END) {
            state.sink.tryEmitComplete();
        }
    }

    private void apply(SessionState state, BridgeEvent event, List<ApprovalRequest> created) {
        JsonNode payload = event.payload();
        switch (event.kind()) {
            case MESSAGE_DELTA -> applyDelta(state, event, payload);
            case MESSAGE_COMPLETE -> applyComplete(state, event, payload);
            case TOOL_CALL -> createApproval(state, event, payload).ifPresent(created::add);
            case TOOL_RESULT -> attachResult(state, event, payload);
            case APPROVAL_RESOLVED -> resolveRemotely(payload);
            case SESSION_STATUS -> {
                state.status = requireText(payload, "to");
                state.touch(event.timestamp());
            }
            case SESSION_END -> {
                state.ended = true;
                state.status = "session:error".equals(text(payload, "type")) ? "error" : "completed";
                state.touch(event.timestamp());
            }
        }
    }

    private void applyDelta(SessionState state, BridgeEvent event, JsonNode payload) {
        String messageId = requireText(payload, "messageId");
        String delta = payload.path("delta").asText("");
        TranscriptMessage existing = state.transcript.get(messageId);
        if (existing == null) {
            existing = new TranscriptMessage(messageId, roleOf(payload), "", true, event.timestamp());
        }
        state.transcript.put(messageId, existing.append(delta, event.timestamp()));
        state.touch(event.timestamp());
    }

    private void applyComplete(SessionState state, BridgeEvent event, JsonNode payload) {
        String messageId = requireText(payload, "messageId");
        String role = roleOf(payload);
        String content = contentOf(payload.path("content"));
        state.transcript.put(messageId, new TranscriptMessage(messageId, role, content, false, event.timestamp()));

        if ("user".equals(role) && state.sessionName == null && !content.isBlank()) {
            String title = content.strip();
            state.sessionName = title.length() > TITLE_LIMIT ? title.substring(0, TITLE_LIMIT) + "..." : title;
        }
        if ("assistant".equals(role) && !content.isEmpty()) {
            state.lastMessage = content;
            state.touch(event.timestamp());
        }
    }

    private Optional<ApprovalRequest> createApproval(SessionState state, BridgeEvent event, JsonNode payload) {
        String requestId = requireText(payload, "requestId");
        if (approvals.containsKey(requestId)) {
            log.debug("Ignoring duplicate approval request {} in session {}", requestId, state.sessionId);
            return Optional.empty();
        }
        String toolCallId = text(payload, "toolCallId");
        if (toolCallId == null) {
            toolCallId = requestId;
        }
        String riskLevel = text(payload, "riskLevel");
        RiskTier tier = RiskTier.fromWire(riskLevel).orElseGet(() -> {
            log.warn("Approval request {} has unrecognized risk tier '{}', treating it as CRITICAL",
                    requestId, riskLevel);
            return RiskTier.CRITICAL;
        });
        ApprovalPayload approvalPayload = new ApprovalPayload(
                text(payload, "toolName"),
                text(payload, "description"),
                payload.path("toolInput").isMissingNode() ? null : payload.get("toolInput"),
                previewOf(payload.path("preview")));

        ApprovalRequest request = new ApprovalRequest(requestId, toolCallId, state.sessionId, state.machineId,
                tier, approvalPayload, event.timestamp(), arrivals.incrementAndGet());
        approvals.put(requestId, request);
        requestIdsByToolCall.put(toolCallId, requestId);
        state.requestIds.add(requestId);
        state.status = "waiting_for_approval";
        state.touch(event.timestamp());
        return Optional.of(request);
    }

    private void attachResult(SessionState state, BridgeEvent event, JsonNode payload) {
        String toolCallId = requireText(payload, "toolCallId");
        String requestId = requestIdsByToolCall.get(toolCallId);
        ApprovalRequest request = requestId == null ? null : approvals.get(requestId);
        if (request == null) {
            log.warn("Dropping tool result for unknown tool call {} in session {}", toolCallId, state.sessionId);
            return;
        }
        JsonNode output = payload.path("output");
        String error = payload.path("error").path("message").asText(null);
        ToolOutcome outcome = new ToolOutcome(
                output.isMissingNode() || output.isNull() ? null : (output.isTextual() ? output.asText() : output.toString()),
                error, event.timestamp());
        if (!request.attachOutcome(outcome)) {
            log.warn("Dropping tool result for request {} which is still pending", request.requestId());
        }
    }

    private void resolveRemotely(JsonNode payload) {
        String requestId = text(payload, "requestId");
        if (requestId == null) {
            String toolCallId = requireText(payload, "toolCallId");
            requestId = requestIdsByToolCall.get(toolCallId);
        }
        ApprovalRequest request = requestId == null ? null : approvals.get(requestId);
        if (request == null) {
            log.debug("Resolution for unknown approval request {}", requestId);
            return;
        }
        ApprovalState terminal = payload.path("approved").asBoolean(false) ? ApprovalState.APPROVED : ApprovalState.DENIED;
        if (request.resolve(terminal, () -> { })) {
            log.info("Approval request {} resolved by machine: {}", request.requestId(), terminal);
        } else {
            log.debug("Approval request {} already resolved", request.requestId());
        }
    }

    // ---- policy ----

    /**
     * Evaluates the policy once and exposes the request.
     *
     * @return true if the request still waits for a human decision
     */
    private boolean route(ApprovalRequest request) {
        PolicyDecision decision = policyEngine.evaluate(request.riskTier(), preferencesStore.get());
        if (decision == PolicyDecision.AUTO_APPROVE) {
            try {
                boolean resolved = request.resolve(ApprovalState.AUTO_APPROVED,
                        () -> commandRouter.send(request.machineId(), ClientMessage.command(request.sessionId(),
                                AgentCommand.approveToolCall(request.requestId(), request.toolCallId()))));
                if (resolved) {
                    log.info("Auto-approved {} request {} ({}) in session {}", request.riskTier(),
                            request.requestId(), request.payload().toolName(), request.sessionId());
                }
                request.expose();
                return request.isPending();
            } catch (NotConnectedException e) {
                log.warn("Could not auto-approve request {}: machine {} is not connected; waiting for a decision",
                        request.requestId(), request.machineId());
            }
        }
        request.expose();
        return request.isPending();
    }

    private void notifyPending(ApprovalRequest request) {
        if (request.isPending()) {
            notificationDispatcher.approvalPending(request.sessionId(), request.requestId());
        }
    }

    // ---- field extraction ----

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String requireText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new MalformedEventException("missing " + field);
        }
        return value;
    }

    private static String roleOf(JsonNode payload) {
        String role = text(payload, "role");
        return role != null ? role : "assistant";
    }

    private static String contentOf(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText())) {
                text.append(part.path("text").asText(""));
            }
        }
        return text.toString();
    }

    private static String previewOf(JsonNode preview) {
        if (preview.isMissingNode() || preview.isNull()) {
            return null;
        }
        return switch (preview.path("type").asText("")) {
            case "diff" -> text(preview, "diff");
            case "command" -> text(preview, "command");
            default -> text(preview, "text");
        };
    }
}
