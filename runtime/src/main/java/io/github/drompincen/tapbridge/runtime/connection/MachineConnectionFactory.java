package io.github.drompincen.tapbridge.runtime.connection;

import io.github.drompincen.tapbridge.protocol.api.MachineDto;

public interface MachineConnectionFactory {
    MachineConnection create(MachineDto machine, MachineConnectionListener listener);
}
