package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.tapbridge.protocol.api.DenyRequest;
import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final BridgeFacade facade;

    public ApprovalController(BridgeFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    public List<ApprovalRequestDto> pending() {
        return facade.pendingApprovals();
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Map<String, String>> approve(@PathVariable String id) {
        facade.approveToolCall(id);
        return ResponseEntity.ok(Map.of("requestId", id, "decision", "approve"));
    }

    @PostMapping("/{id}/deny")
    public ResponseEntity<Map<String, String>> deny(@PathVariable String id,
                                                    @RequestBody(required = false) DenyRequest req) {
        facade.denyToolCall(id, req != null ? req.reason() : null);
        return ResponseEntity.ok(Map.of("requestId", id, "decision", "deny"));
    }
}
