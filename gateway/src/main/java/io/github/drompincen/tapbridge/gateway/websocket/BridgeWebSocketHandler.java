package io.github.drompincen.tapbridge.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.WsMessage;
import io.github.drompincen.tapbridge.protocol.ws.WsMessageType;
import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import io.github.drompincen.tapbridge.runtime.bridge.NotConnectedException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownApprovalRequestException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.Disposable;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Presentation-facing socket: session subscriptions and the command surface of the bridge.
 */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(BridgeWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final BridgeFacade facade;
    private final ApprovalNotificationBroadcaster broadcaster;

    private final Map<String, WebSocketSession> clients = new ConcurrentHashMap<>();
    // client id -> bridge session id -> live subscription
    private final Map<String, Map<String, Disposable>> subscriptions = new ConcurrentHashMap<>();

    public BridgeWebSocketHandler(ObjectMapper objectMapper, BridgeFacade facade,
                                  ApprovalNotificationBroadcaster broadcaster) {
        this.objectMapper = objectMapper;
        this.facade = facade;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession client = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        clients.put(session.getId(), client);
        subscriptions.put(session.getId(), new ConcurrentHashMap<>());
        broadcaster.register(client);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession client = clients.remove(session.getId());
        if (client != null) {
            broadcaster.unregister(client);
        }
        Map<String, Disposable> subs = subscriptions.remove(session.getId());
        if (subs != null) {
            subs.forEach((sessionId, subscription) -> {
                subscription.dispose();
                releaseIfUnwatched(sessionId);
            });
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WebSocketSession client = clients.getOrDefault(session.getId(), session);
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String sessionId = node.path("sessionId").asText(null);

        WsMessageType messageType;
        try {
            messageType = WsMessageType.valueOf(type);
        } catch (IllegalArgumentException e) {
            sendError(client, sessionId, "Unknown message type: " + type);
            return;
        }

        try {
            switch (messageType) {
                case SUBSCRIBE_SESSION -> subscribe(session.getId(), client, sessionId);
                case UNSUBSCRIBE -> unsubscribe(session.getId(), client, sessionId);
                case SEND_MESSAGE -> facade.sendMessage(sessionId, node.path("content").asText(""));
                case APPROVE_TOOL_CALL -> facade.approveToolCall(node.path("requestId").asText());
                case DENY_TOOL_CALL -> facade.denyToolCall(node.path("requestId").asText(),
                        node.path("reason").asText(null));
                case CANCEL_SESSION -> facade.cancelSession(sessionId);
                default -> sendError(client, sessionId, "Unsupported message type: " + type);
            }
        } catch (NotConnectedException | UnknownSessionException | UnknownApprovalRequestException e) {
            sendError(client, sessionId, e.getMessage());
        }
    }

    private void subscribe(String clientId, WebSocketSession client, String sessionId) throws IOException {
        Map<String, Disposable> subs = subscriptions.computeIfAbsent(clientId, k -> new ConcurrentHashMap<>());
        if (!subs.containsKey(sessionId)) {
            AtomicBoolean failed = new AtomicBoolean();
            Disposable subscription = facade.subscribeToSession(sessionId).subscribe(
                    event -> push(client, event),
                    error -> {
                        failed.set(true);
                        subs.remove(sessionId);
                        sendError(client, sessionId, error.getMessage());
                    },
                    () -> subs.remove(sessionId));
            if (failed.get()) {
                return;
            }
            if (!subscription.isDisposed()) {
                subs.put(sessionId, subscription);
            }
            log.debug("Client {} subscribed to session {}", clientId, sessionId);
        }
        send(client, WsMessage.subscribed(sessionId));
    }

    private void unsubscribe(String clientId, WebSocketSession client, String sessionId) throws IOException {
        Map<String, Disposable> subs = subscriptions.get(clientId);
        Disposable subscription = subs == null ? null : subs.remove(sessionId);
        if (subscription != null) {
            subscription.dispose();
            releaseIfUnwatched(sessionId);
        }
        send(client, WsMessage.unsubscribed(sessionId));
    }

    private void releaseIfUnwatched(String sessionId) {
        boolean watched = subscriptions.values().stream().anyMatch(subs -> subs.containsKey(sessionId));
        if (watched) {
            return;
        }
        try {
            facade.unsubscribeFromSession(sessionId);
        } catch (NotConnectedException | UnknownSessionException e) {
            log.debug("Skipped daemon unsubscribe for session {}: {}", sessionId, e.getMessage());
        }
    }

    private void push(WebSocketSession client, BridgeEvent event) {
        try {
            send(client, WsMessage.event(event));
        } catch (IOException e) {
            log.warn("Could not push event of session {} to client {}: {}",
                    event.sessionId(), client.getId(), e.getMessage());
        }
    }

    private void sendError(WebSocketSession client, String sessionId, String error) {
        try {
            send(client, WsMessage.error(sessionId, error));
        } catch (IOException e) {
            log.warn("Could not send error to client {}: {}", client.getId(), e.getMessage());
        }
    }

    private void send(WebSocketSession client, WsMessage message) throws IOException {
        if (client.isOpen()) {
            client.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }
    }
}
