package io.github.drompincen.tapbridge.gateway.config;

import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Bridge settings bound from {@code tapbridge.*}.
 *
 * @param authToken    token sent to every machine daemon on connect
 * @param keepalive    interval between daemon pings; zero disables them
 * @param autoConnect  connect to every eligible machine once the application is ready
 * @param autoApproval initial auto-approval preferences
 * @param machines     statically linked machines
 */
@ConfigurationProperties(prefix = "tapbridge")
public record TapBridgeProperties(
        String authToken,
        Duration keepalive,
        boolean autoConnect,
        AutoApprovalPreferences autoApproval,
        List<MachineDto> machines
) {
    public TapBridgeProperties {
        if (keepalive == null) keepalive = Duration.ofSeconds(30);
        if (autoApproval == null) autoApproval = AutoApprovalPreferences.none();
        if (machines == null) machines = List.of();
    }
}
