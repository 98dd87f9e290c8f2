package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.tapbridge.protocol.api.MessageDto;
import io.github.drompincen.tapbridge.protocol.api.SendMessageRequest;
import io.github.drompincen.tapbridge.protocol.api.SessionDto;
import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final BridgeFacade facade;

    public SessionController(BridgeFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    public List<SessionDto> list() {
        return facade.sessions();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionDto> get(@PathVariable String id) {
        return facade.session(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/messages")
    public List<MessageDto> messages(@PathVariable String id) {
        return facade.messages(id);
    }

    @GetMapping("/{id}/approvals")
    public List<ApprovalRequestDto> approvals(@PathVariable String id) {
        return facade.pendingApprovals(id);
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<?> sendMessage(@PathVariable String id, @RequestBody SendMessageRequest req) {
        if (req == null || req.content() == null || req.content().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "content is required"));
        }
        facade.sendMessage(id, req.content());
        return ResponseEntity.accepted().body(Map.of("status", "sent", "sessionId", id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        facade.cancelSession(id);
        return ResponseEntity.accepted().body(Map.of("status", "cancel_requested", "sessionId", id));
    }
}
