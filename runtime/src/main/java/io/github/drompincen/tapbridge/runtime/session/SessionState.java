package io.github.drompincen.tapbridge.runtime.session;

import io.github.drompincen.tapbridge.protocol.api.MessageDto;
import io.github.drompincen.tapbridge.protocol.api.SessionDto;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one session. Guarded by its own monitor; callers synchronize on the instance.
 */
class SessionState {

    final String sessionId;
    String machineId;

    final Map<String, TranscriptMessage> transcript = new LinkedHashMap<>();
    final List<BridgeEvent> buffer = new ArrayList<>();
    final Set<String> requestIds = new LinkedHashSet<>();
    final Sinks.Many<BridgeEvent> sink = Sinks.many().multicast().directBestEffort();

    boolean loadingHistory;
    boolean historyLoaded;
    boolean ended;

    String agent;
    String projectName;
    String sessionName;
    String status;
    String lastMessage;
    Instant lastActivity;

    SessionState(String sessionId, String machineId) {
        this.sessionId = sessionId;
        this.machineId = machineId;
    }

    void merge(String owningMachineId, SessionInfo info) {
        machineId = info.machineId() != null ? info.machineId() : owningMachineId;
        if (info.agent() != null) {
            agent = info.agent();
        }
        if (info.projectName() != null) {
            projectName = info.projectName();
        }
        if (info.sessionName() != null) {
            sessionName = info.sessionName();
        }
        if (info.status() != null) {
            status = info.status();
        }
        if (info.lastActivity() != null) {
            lastActivity = info.lastActivity();
        }
    }

    void touch(Instant at) {
        if (at != null && (lastActivity == null || at.isAfter(lastActivity))) {
            lastActivity = at;
        }
    }

    void resetHistory() {
        buffer.clear();
        loadingHistory = false;
        historyLoaded = false;
    }

    SessionDto toDto() {
        return new SessionDto(sessionId, machineId, agent, projectName, sessionName, status, lastMessage,
                loadingHistory, historyLoaded, ended, transcript.size(), lastActivity);
    }

    List<MessageDto> messages() {
        List<MessageDto> out = new ArrayList<>(transcript.size());
        for (TranscriptMessage message : transcript.values()) {
            out.add(message.toDto(sessionId));
        }
        return out;
    }
}
