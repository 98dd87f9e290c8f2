package io.github.drompincen.tapbridge.gateway.config;

import io.github.drompincen.tapbridge.runtime.bridge.BridgeFacade;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Connects on startup when configured to, and closes every machine connection on shutdown.
 */
@Component
public class BridgeLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BridgeLifecycle.class);

    private final BridgeFacade facade;
    private final TapBridgeProperties properties;

    public BridgeLifecycle(BridgeFacade facade, TapBridgeProperties properties) {
        this.facade = facade;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (properties.autoConnect()) {
            log.info("Auto-connecting to linked machines");
            facade.connectAll();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing machine connections");
        facade.disconnectAll();
    }
}
