package io.github.drompincen.tapbridge.runtime.connection;

import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.client.WebSocketClient;

import java.time.Duration;

public class WebSocketMachineConnectionFactory implements MachineConnectionFactory {

    private final WebSocketClient client;
    private final DaemonMessageCodec codec;
    private final TaskScheduler scheduler;
    private final String token;
    private final Duration keepalive;

    public WebSocketMachineConnectionFactory(WebSocketClient client, DaemonMessageCodec codec,
                                             TaskScheduler scheduler, String token, Duration keepalive) {
        this.client = client;
        this.codec = codec;
        this.scheduler = scheduler;
        this.token = token;
        this.keepalive = keepalive;
    }

    @Override
    public MachineConnection create(MachineDto machine, MachineConnectionListener listener) {
        return new WebSocketMachineConnection(machine.id(), machine.tunnelUrl(), token,
                client, codec, scheduler, keepalive, listener);
    }
}
