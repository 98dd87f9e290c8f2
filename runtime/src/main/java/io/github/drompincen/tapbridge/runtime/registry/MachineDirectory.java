package io.github.drompincen.tapbridge.runtime.registry;

import io.github.drompincen.tapbridge.protocol.api.MachineDto;

import java.util.List;

/**
 * The user's linked machines, as known to the account service.
 */
public interface MachineDirectory {
    List<MachineDto> list();
}
