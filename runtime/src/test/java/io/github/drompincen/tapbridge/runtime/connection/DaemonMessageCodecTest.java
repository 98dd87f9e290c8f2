package io.github.drompincen.tapbridge.runtime.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.event.EventKind;
import io.github.drompincen.tapbridge.protocol.ws.AgentCommand;
import io.github.drompincen.tapbridge.protocol.ws.ClientMessage;
import io.github.drompincen.tapbridge.protocol.ws.DaemonMessage;
import io.github.drompincen.tapbridge.protocol.ws.DaemonMessageType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DaemonMessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final DaemonMessageCodec codec = new DaemonMessageCodec(mapper);

    @Test
    void encodesCommandWithoutNullFields() throws Exception {
        String json = codec.encode(ClientMessage.command("s1", AgentCommand.approveToolCall("r1", "tc1")));

        JsonNode node = mapper.readTree(json);
        assertThat(node.path("type").asText()).isEqualTo("command");
        assertThat(node.path("command").path("command").asText()).isEqualTo("approve_tool_call");
        assertThat(node.has("token")).isFalse();
        assertThat(node.path("command").has("reason")).isFalse();
    }

    @Test
    void decodesSessionsList() throws Exception {
        DaemonMessage message = codec.decode("""
                {"type":"sessions_list","sessions":[
                  {"id":"s1","agent":"claude-code","projectName":"api","status":"running",
                   "lastActivity":"2026-01-01T10:00:00Z","extra":"ignored"}]}
                """);

        assertThat(message.type()).isEqualTo(DaemonMessageType.SESSIONS_LIST);
        List<SessionInfo> sessions = codec.sessions(message);
        assertThat(sessions).hasSize(1);
        assertThat(sessions.get(0).id()).isEqualTo("s1");
        assertThat(sessions.get(0).lastActivity()).isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void skipsSessionEntriesThatDoNotBind() throws Exception {
        DaemonMessage message = codec.decode("""
                {"type":"sessions_list","sessions":[
                  {"id":"s1","lastActivity":"yesterday"},
                  {"id":"s2","status":"idle"}]}
                """);

        assertThat(codec.sessions(message)).extracting(SessionInfo::id).containsExactly("s2");
    }

    @Test
    void sessionsListWithoutArrayIsEmpty() throws Exception {
        assertThat(codec.sessions(codec.decode("{\"type\":\"sessions_list\"}"))).isEmpty();
    }

    @Test
    void normalizesKnownEvent() throws Exception {
        JsonNode event = mapper.readTree("""
                {"type":"message:delta","sessionId":"s1","seq":7,"messageId":"m","delta":"hi",
                 "timestamp":"2026-01-01T10:00:00Z"}
                """);

        Optional<BridgeEvent> result = codec.toBridgeEvent("m1", event);

        assertThat(result).isPresent();
        assertThat(result.get().kind()).isEqualTo(EventKind.MESSAGE_DELTA);
        assertThat(result.get().machineId()).isEqualTo("m1");
        assertThat(result.get().seq()).isEqualTo(7);
        assertThat(result.get().timestamp()).isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void ignoresUntrackedEventTypes() throws Exception {
        JsonNode event = mapper.readTree("{\"type\":\"thinking:delta\",\"sessionId\":\"s1\"}");

        assertThat(codec.toBridgeEvent("m1", event)).isEmpty();
    }

    @Test
    void dropsEventWithoutSession() throws Exception {
        JsonNode event = mapper.readTree("{\"type\":\"message:delta\",\"messageId\":\"m\"}");

        assertThat(codec.toBridgeEvent("m1", event)).isEmpty();
    }

    @Test
    void badTimestampFallsBackToNow() throws Exception {
        JsonNode event = mapper.readTree("{\"type\":\"session:completed\",\"sessionId\":\"s1\",\"timestamp\":\"yesterday\"}");

        assertThat(codec.toBridgeEvent("m1", event)).map(BridgeEvent::timestamp).isPresent();
    }
}
