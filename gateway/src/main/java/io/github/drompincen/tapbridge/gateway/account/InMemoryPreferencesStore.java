package io.github.drompincen.tapbridge.gateway.account;

import io.github.drompincen.tapbridge.gateway.config.TapBridgeProperties;
import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import io.github.drompincen.tapbridge.runtime.approval.PreferencesStore;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

@Component
public class InMemoryPreferencesStore implements PreferencesStore {

    private final AtomicReference<AutoApprovalPreferences> preferences;

    public InMemoryPreferencesStore(TapBridgeProperties properties) {
        this.preferences = new AtomicReference<>(properties.autoApproval());
    }

    @Override
    public AutoApprovalPreferences get() {
        return preferences.get();
    }

    public void set(AutoApprovalPreferences next) {
        preferences.set(next);
    }
}
