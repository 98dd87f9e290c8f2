package io.github.drompincen.tapbridge.runtime.bridge;

import io.github.drompincen.tapbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.tapbridge.protocol.api.ApprovalState;
import io.github.drompincen.tapbridge.protocol.api.ConnectionStatusDto;
import io.github.drompincen.tapbridge.protocol.api.MessageDto;
import io.github.drompincen.tapbridge.protocol.api.SessionDto;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.AgentCommand;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.runtime.approval.ApprovalRequest;
import io.github.drompincen.tapbridge.runtime.registry.ConnectionRegistry;
import io.github.drompincen.tapbridge.runtime.session.SessionEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

/**
 * The single entry point for presentation code: subscriptions, commands and read-only snapshots.
 * <p>
 * Commands are fire-and-forget. A command for a machine that is not connected fails with
 * {@link NotConnectedException} before anything changes; nothing is queued or retried.
 */
@Service
public class BridgeFacade {

    private static final Logger log = LoggerFactory.getLogger(BridgeFacade.class);

    private final ConnectionRegistry registry;
    private final SessionEventStore store;
    private final CommandRouter router;

    public BridgeFacade(ConnectionRegistry registry, SessionEventStore store, CommandRouter router) {
        this.registry = registry;
        this.store = store;
        this.router = router;
    }

    // ---- subscriptions ----

    /**
     * Live events of a session. Nothing happens until subscription; then history loading starts
     * and the owning machine is asked to stream the session. The stream ends with the session or
     * when disposed, and never replays events across reconnects.
     *
     * @throws UnknownSessionException if the session has never been seen
     */
    public Flux<BridgeEvent> subscribeToSession(String sessionId) {
        String machineId = machineOf(sessionId);
        return Flux.defer(() -> {
            if (store.session(sessionId).map(SessionDto::ended).orElse(false)) {
                return Flux.empty();
            }
            Flux<BridgeEvent> events = store.events(sessionId);
            if (store.startHistoryLoading(sessionId)) {
                try {
                    router.send(machineId, ClientMessage.subscribe(List.of(sessionId)));
                } catch (NotConnectedException e) {
                    store.cancelHistoryLoading(sessionId);
                    return Flux.error(e);
                }
                log.info("Subscribed to session {} on machine {}", sessionId, machineId);
            }
            return events;
        });
    }

    public void unsubscribeFromSession(String sessionId) {
        String machineId = machineOf(sessionId);
        if (!router.isConnected(machineId)) {
            log.debug("Machine {} not connected, nothing to unsubscribe for session {}", machineId, sessionId);
            return;
        }
        router.send(machineId, ClientMessage.unsubscribe(List.of(sessionId)));
    }

    // ---- commands ----

    public void sendMessage(String sessionId, String text) {
        String machineId = machineOf(sessionId);
        router.send(machineId, ClientMessage.command(sessionId, AgentCommand.sendMessage(text)));
        log.info("Sent message to session {}", sessionId);
    }

    public void approveToolCall(String requestId) {
        ApprovalRequest request = requireApproval(requestId);
        boolean resolved = request.resolve(ApprovalState.APPROVED, () -> router.send(request.machineId(),
                ClientMessage.command(request.sessionId(),
                        AgentCommand.approveToolCall(request.requestId(), request.toolCallId()))));
        if (resolved) {
            log.info("Approved request {} in session {}", requestId, request.sessionId());
        } else {
            log.debug("Request {} already resolved as {}", requestId, request.state());
        }
    }

    public void denyToolCall(String requestId) {
        denyToolCall(requestId, null);
    }

    public void denyToolCall(String requestId, String reason) {
        ApprovalRequest request = requireApproval(requestId);
        boolean resolved = request.resolve(ApprovalState.DENIED, () -> router.send(request.machineId(),
                ClientMessage.command(request.sessionId(),
                        AgentCommand.denyToolCall(request.requestId(), request.toolCallId(), reason))));
        if (resolved) {
            log.info("Denied request {} in session {}", requestId, request.sessionId());
        } else {
            log.debug("Request {} already resolved as {}", requestId, request.state());
        }
    }

    public void cancelSession(String sessionId) {
        String machineId = machineOf(sessionId);
        router.send(machineId, ClientMessage.terminateSession(sessionId));
        log.info("Cancel requested for session {}", sessionId);
    }

    // ---- connections ----

    public void connectAll() {
        registry.connectAll();
    }

    public void disconnectAll() {
        registry.disconnectAll();
    }

    public void refreshAll() {
        registry.refreshAll();
    }

    // ---- snapshots ----

    public ConnectionStatusDto status() {
        return registry.snapshot();
    }

    public List<SessionDto> sessions() {
        return store.sessions();
    }

    public Optional<SessionDto> session(String sessionId) {
        return store.session(sessionId);
    }

    public List<MessageDto> messages(String sessionId) {
        machineOf(sessionId);
        return store.messages(sessionId);
    }

    public List<ApprovalRequestDto> pendingApprovals() {
        return store.pendingApprovals();
    }

    public List<ApprovalRequestDto> pendingApprovals(String sessionId) {
        machineOf(sessionId);
        return store.pendingApprovals(sessionId);
    }

    private String machineOf(String sessionId) {
        return store.machineIdFor(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    private ApprovalRequest requireApproval(String requestId) {
        return store.approval(requestId).orElseThrow(() -> new UnknownApprovalRequestException(requestId));
    }
}
