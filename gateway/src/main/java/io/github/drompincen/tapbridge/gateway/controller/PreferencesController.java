package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.gateway.account.InMemoryPreferencesStore;
import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/preferences")
public class PreferencesController {

    private final InMemoryPreferencesStore preferencesStore;

    public PreferencesController(InMemoryPreferencesStore preferencesStore) {
        this.preferencesStore = preferencesStore;
    }

    @GetMapping
    public AutoApprovalPreferences get() {
        return preferencesStore.get();
    }

    @PutMapping
    public AutoApprovalPreferences update(@RequestBody AutoApprovalPreferences preferences) {
        preferencesStore.set(preferences);
        return preferencesStore.get();
    }
}
