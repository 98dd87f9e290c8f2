package io.github.drompincen.tapbridge.runtime.approval;

import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;

public interface PreferencesStore {
    AutoApprovalPreferences get();
}
