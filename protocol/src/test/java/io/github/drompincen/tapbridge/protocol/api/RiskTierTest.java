package io.github.drompincen.tapbridge.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskTierTest {

    @Test
    void parsesLowercaseWireValues() {
        assertThat(RiskTier.fromWire("low")).contains(RiskTier.LOW);
        assertThat(RiskTier.fromWire("medium")).contains(RiskTier.MEDIUM);
        assertThat(RiskTier.fromWire("high")).contains(RiskTier.HIGH);
        assertThat(RiskTier.fromWire(" Critical ")).contains(RiskTier.CRITICAL);
    }

    @Test
    void unknownOrMissingValuesAreEmpty() {
        assertThat(RiskTier.fromWire("extreme")).isEmpty();
        assertThat(RiskTier.fromWire("")).isEmpty();
        assertThat(RiskTier.fromWire(null)).isEmpty();
    }

    @Test
    void onlyPendingIsNonTerminal() {
        assertThat(ApprovalState.PENDING.isTerminal()).isFalse();
        assertThat(ApprovalState.APPROVED.isTerminal()).isTrue();
        assertThat(ApprovalState.AUTO_APPROVED.isTerminal()).isTrue();
        assertThat(ApprovalState.AUTO_DENIED.isTerminal()).isTrue();
    }
}
