package io.github.drompincen.tapbridge.protocol.api;

import java.util.Locale;
import java.util.Optional;

public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parses the lowercase risk level carried by agent events ("low", "medium", ...).
     */
    public static Optional<RiskTier> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
