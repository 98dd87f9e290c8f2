package io.github.drompincen.tapbridge.runtime.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.protocol.ws.DaemonMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Daemon connection over a WebSocket: authenticates with a token, keeps the socket alive with
 * pings and turns daemon messages into status transitions, listener callbacks and bridge events.
 */
public class WebSocketMachineConnection extends TextWebSocketHandler implements MachineConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketMachineConnection.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final String machineId;
    private final String endpoint;
    private final String token;
    private final WebSocketClient client;
    private final DaemonMessageCodec codec;
    private final TaskScheduler scheduler;
    private final Duration keepalive;
    private final MachineConnectionListener listener;

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile WebSocketSession session;
    private volatile ScheduledFuture<?> pingTask;
    private volatile boolean closing;
    private volatile Sinks.Many<BridgeEvent> sink = newSink();
    private volatile boolean sinkCompleted;

    public WebSocketMachineConnection(String machineId, String endpoint, String token,
                                      WebSocketClient client, DaemonMessageCodec codec,
                                      TaskScheduler scheduler, Duration keepalive,
                                      MachineConnectionListener listener) {
        this.machineId = machineId;
        this.endpoint = endpoint;
        this.token = token;
        this.client = client;
        this.codec = codec;
        this.scheduler = scheduler;
        this.keepalive = keepalive;
        this.listener = listener;
    }

    @Override
    public String machineId() {
        return machineId;
    }

    @Override
    public ConnectionStatus status() {
        return status;
    }

    @Override
    public Flux<BridgeEvent> events() {
        return Flux.defer(() -> sink.asFlux());
    }

    @Override
    public void connect() {
        if (status == ConnectionStatus.CONNECTED || status == ConnectionStatus.CONNECTING) {
            return;
        }
        closing = false;
        if (sinkCompleted) {
            sink = newSink();
            sinkCompleted = false;
        }
        transition(ConnectionStatus.CONNECTING);

        URI uri;
        try {
            uri = toWebSocketUri(endpoint);
        } catch (IllegalArgumentException e) {
            log.warn("Machine {} has a malformed endpoint {}: {}", machineId, endpoint, e.getMessage());
            fail("Malformed endpoint: " + endpoint);
            return;
        }

        log.info("Connecting to machine {} at {}", machineId, uri);
        client.execute(this, new WebSocketHttpHeaders(), uri).whenComplete((ws, ex) -> {
            if (ex != null) {
                log.warn("Connection to machine {} failed: {}", machineId, ex.getMessage());
                fail("Failed to connect: " + ex.getMessage());
            }
        });
    }

    @Override
    public void disconnect() {
        closing = true;
        stopPing();
        WebSocketSession ws = session;
        session = null;
        if (ws != null && ws.isOpen()) {
            try {
                ws.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing socket for machine {}: {}", machineId, e.getMessage());
            }
        }
        transition(ConnectionStatus.DISCONNECTED);
        completeEvents();
    }

    @Override
    public boolean send(ClientMessage message) {
        WebSocketSession ws = session;
        if (ws == null || !ws.isOpen()) {
            return false;
        }
        try {
            ws.sendMessage(new TextMessage(codec.encode(message)));
            return true;
        } catch (IOException e) {
            log.warn("Send to machine {} failed: {}", machineId, e.getMessage());
            return false;
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        if (closing) {
            closeQuietly(ws);
            return;
        }
        session = new ConcurrentWebSocketSessionDecorator(ws, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        if (!send(ClientMessage.auth(token))) {
            fail("Could not send auth message");
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        DaemonMessage msg;
        try {
            msg = codec.decode(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable message from machine {}: {}", machineId, e.getOriginalMessage());
            return;
        }

        switch (msg.type()) {
            case AUTH_SUCCESS -> {
                transition(ConnectionStatus.CONNECTED);
                startPing();
            }
            case AUTH_ERROR -> {
                String reason = msg.text("message");
                log.warn("Machine {} rejected authentication: {}", machineId, reason);
                fail(reason != null ? reason : "Authentication failed");
                closeQuietly(ws);
            }
            case SESSIONS_LIST -> listener.onSessionsListed(machineId, codec.sessions(msg));
            case ACP_EVENT -> codec.toBridgeEvent(machineId, msg.body().path("event")).ifPresent(this::emit);
            case HISTORY_COMPLETE -> listener.onHistoryComplete(machineId, msg.text("sessionId"));
            case ERROR -> listener.onError(machineId, msg.text("message"));
            case PONG -> { }
            default -> log.debug("Ignoring message {} from machine {}", msg.text("type"), machineId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        log.warn("Transport error on machine {}: {}", machineId, exception.getMessage());
        transition(ConnectionStatus.ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus closeStatus) {
        stopPing();
        session = null;
        // an error status outlives the close that follows it; explicit disconnects always win
        if (closing || status != ConnectionStatus.ERROR) {
            transition(ConnectionStatus.DISCONNECTED);
        }
        log.info("Connection to machine {} closed ({})", machineId, closeStatus);
        completeEvents();
    }

    static URI toWebSocketUri(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is empty");
        }
        String url = endpoint.trim().replaceFirst("^http", "ws");
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        URI uri = URI.create(url + "/ws");
        if (!"ws".equals(uri.getScheme()) && !"wss".equals(uri.getScheme())) {
            throw new IllegalArgumentException("unsupported scheme " + uri.getScheme());
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host");
        }
        return uri;
    }

    private void emit(BridgeEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Dropped event {} for session {} from machine {}: {}",
                    event.kind(), event.sessionId(), machineId, result);
        }
    }

    private void completeEvents() {
        sinkCompleted = true;
        sink.tryEmitComplete();
    }

    private void fail(String message) {
        transition(ConnectionStatus.ERROR);
        listener.onError(machineId, message);
    }

    private synchronized void transition(ConnectionStatus next) {
        if (status == next) {
            return;
        }
        log.debug("Machine {} {} -> {}", machineId, status, next);
        status = next;
        listener.onStatusChange(machineId, next);
    }

    private void startPing() {
        stopPing();
        if (scheduler != null && keepalive != null && !keepalive.isZero()) {
            pingTask = scheduler.scheduleAtFixedRate(() -> send(ClientMessage.ping()), keepalive);
        }
    }

    private void stopPing() {
        ScheduledFuture<?> task = pingTask;
        pingTask = null;
        if (task != null) {
            task.cancel(false);
        }
    }

    private void closeQuietly(WebSocketSession ws) {
        try {
            ws.close(CloseStatus.POLICY_VIOLATION);
        } catch (IOException e) {
            log.debug("Error closing socket for machine {}: {}", machineId, e.getMessage());
        }
    }

    private static Sinks.Many<BridgeEvent> newSink() {
        return Sinks.many().multicast().directBestEffort();
    }
}
