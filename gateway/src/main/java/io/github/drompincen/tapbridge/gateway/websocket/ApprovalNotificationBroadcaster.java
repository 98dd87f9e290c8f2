package io.github.drompincen.tapbridge.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.WsMessage;
import io.github.drompincen.tapbridge.runtime.approval.NotificationDispatcher;
import io.github.drompincen.tapbridge.runtime.registry.ConnectionRegistry;
import io.github.drompincen.tapbridge.runtime.registry.MachineEventListener;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes pending approvals and connectivity changes to every connected presentation client.
 */
@Component
public class ApprovalNotificationBroadcaster implements NotificationDispatcher, MachineEventListener {

    private static final Logger log = LoggerFactory.getLogger(ApprovalNotificationBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final Set<WebSocketSession> clients = new CopyOnWriteArraySet<>();

    public ApprovalNotificationBroadcaster(ObjectMapper objectMapper, ConnectionRegistry registry) {
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        registry.addListener(this);
    }

    public void register(WebSocketSession client) {
        clients.add(client);
    }

    public void unregister(WebSocketSession client) {
        clients.remove(client);
    }

    @Override
    public void approvalPending(String sessionId, String requestId) {
        broadcast(WsMessage.approvalPending(sessionId, requestId));
    }

    @Override
    public void onEvent(BridgeEvent event) {
        // session events go to per-session subscribers only
    }

    @Override
    public void onMachineStatus(String machineId, ConnectionStatus status) {
        broadcast(WsMessage.status(objectMapper.valueToTree(registry.snapshot())));
    }

    private void broadcast(WsMessage message) {
        if (clients.isEmpty()) {
            return;
        }
        TextMessage text;
        try {
            text = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} message", message.type(), e);
            return;
        }
        for (WebSocketSession client : clients) {
            if (!client.isOpen()) {
                continue;
            }
            try {
                client.sendMessage(text);
            } catch (IOException e) {
                log.warn("Could not push {} to client {}: {}", message.type(), client.getId(), e.getMessage());
            }
        }
    }
}
