package io.github.drompincen.tapbridge.runtime.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.event.EventKind;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.protocol.ws.DaemonMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class DaemonMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(DaemonMessageCodec.class);

    private final ObjectMapper objectMapper;

    public DaemonMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ClientMessage message) throws JsonProcessingException {
        return objectMapper.writeValueAsString(message);
    }

    public DaemonMessage decode(String json) throws JsonProcessingException {
        return DaemonMessage.of(objectMapper.readTree(json));
    }

    /**
     * Entries of a {@code sessions_list} message; entries that do not bind are skipped.
     */
    public List<SessionInfo> sessions(DaemonMessage message) {
        JsonNode sessions = message.body().path("sessions");
        if (!sessions.isArray()) {
            return List.of();
        }
        List<SessionInfo> result = new ArrayList<>(sessions.size());
        for (JsonNode entry : sessions) {
            try {
                result.add(objectMapper.treeToValue(entry, SessionInfo.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed session entry {}: {}", entry.path("id").asText("?"), e.getMessage());
            }
        }
        return result;
    }

    /**
     * Normalizes the {@code event} of an {@code acp_event} message. Event types the bridge does
     * not track yield empty; events without a session id are dropped as malformed.
     */
    public Optional<BridgeEvent> toBridgeEvent(String machineId, JsonNode event) {
        String type = event.path("type").asText(null);
        Optional<EventKind> kind = EventKind.fromWire(type);
        if (kind.isEmpty()) {
            log.debug("Ignoring event type {} from machine {}", type, machineId);
            return Optional.empty();
        }
        String sessionId = event.path("sessionId").asText(null);
        if (sessionId == null || sessionId.isBlank()) {
            log.warn("Dropping malformed {} event from machine {}: missing sessionId", type, machineId);
            return Optional.empty();
        }
        return Optional.of(new BridgeEvent(machineId, sessionId, kind.get(),
                event.path("seq").asLong(0), event, parseTimestamp(event.path("timestamp").asText(null))));
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return Instant.now();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
