package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.gateway.account.InMemoryMachineDirectory;
import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/machines")
public class MachineController {

    private final InMemoryMachineDirectory directory;
    private final BridgeFacade facade;

    public MachineController(InMemoryMachineDirectory directory, BridgeFacade facade) {
        this.directory = directory;
        this.facade = facade;
    }

    @GetMapping
    public List<MachineDto> list() {
        return directory.list();
    }

    /**
     * Replaces the linked machines and reconciles connections against the new list.
     */
    @PutMapping
    public ResponseEntity<?> replace(@RequestBody List<MachineDto> machines) {
        if (machines.stream().anyMatch(m -> m.id() == null || m.id().isBlank())) {
            return ResponseEntity.badRequest().body(Map.of("error", "every machine needs an id"));
        }
        directory.replace(machines);
        facade.connectAll();
        return ResponseEntity.ok(directory.list());
    }
}
