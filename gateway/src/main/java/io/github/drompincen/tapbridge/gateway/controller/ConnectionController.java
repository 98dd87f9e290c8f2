package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatusDto;
import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class ConnectionController {

    private final BridgeFacade facade;

    public ConnectionController(BridgeFacade facade) {
        this.facade = facade;
    }

    @GetMapping("/status")
    public ConnectionStatusDto status() {
        return facade.status();
    }

    @PostMapping("/connections/connect-all")
    public ConnectionStatusDto connectAll() {
        facade.connectAll();
        return facade.status();
    }

    @PostMapping("/connections/disconnect-all")
    public ConnectionStatusDto disconnectAll() {
        facade.disconnectAll();
        return facade.status();
    }

    @PostMapping("/connections/refresh")
    public ConnectionStatusDto refresh() {
        facade.refreshAll();
        return facade.status();
    }
}
