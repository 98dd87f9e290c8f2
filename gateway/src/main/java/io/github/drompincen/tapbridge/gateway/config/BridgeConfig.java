package io.github.drompincen.tapbridge.gateway.config;

import io.github.drompincen.tapbridge.runtime.connection.DaemonMessageCodec;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnectionFactory;
import io.github.drompincen.tapbridge.runtime.connection.WebSocketMachineConnectionFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the outbound daemon transport.
 */
@Configuration
public class BridgeConfig {

    @Bean
    WebSocketClient daemonWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    MachineConnectionFactory machineConnectionFactory(WebSocketClient daemonWebSocketClient,
                                                      DaemonMessageCodec codec,
                                                      @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                                                      TapBridgeProperties properties) {
        return new WebSocketMachineConnectionFactory(daemonWebSocketClient, codec, taskScheduler,
                properties.authToken(), properties.keepalive());
    }
}
