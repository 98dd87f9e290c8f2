package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.gateway.account.InMemoryPreferencesStore;
import io.github.drompincen.tapbridge.gateway.config.TapBridgeProperties;
import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreferencesControllerTest {

    private final InMemoryPreferencesStore store =
            new InMemoryPreferencesStore(new TapBridgeProperties(null, null, false, null, null));
    private final PreferencesController controller = new PreferencesController(store);

    @Test
    void defaultsToNoAutoApproval() {
        assertThat(controller.get()).isEqualTo(AutoApprovalPreferences.none());
    }

    @Test
    void updateIsVisibleToPolicyReads() {
        AutoApprovalPreferences lowAndMedium = new AutoApprovalPreferences(true, true, false, false);

        controller.update(lowAndMedium);

        assertThat(store.get()).isEqualTo(lowAndMedium);
    }
}
