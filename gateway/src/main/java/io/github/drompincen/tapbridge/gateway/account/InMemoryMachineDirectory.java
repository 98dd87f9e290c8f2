package io.github.drompincen.tapbridge.gateway.account;

import io.github.drompincen.tapbridge.gateway.config.TapBridgeProperties;
import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import io.github.drompincen.tapbridge.runtime.registry.MachineDirectory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Linked machines, seeded from configuration and replaceable at runtime.
 */
@Component
public class InMemoryMachineDirectory implements MachineDirectory {

    private volatile List<MachineDto> machines;

    public InMemoryMachineDirectory(TapBridgeProperties properties) {
        this.machines = List.copyOf(properties.machines());
    }

    @Override
    public List<MachineDto> list() {
        return machines;
    }

    public void replace(List<MachineDto> next) {
        machines = List.copyOf(next);
    }
}
