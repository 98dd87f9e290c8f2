package io.github.drompincen.tapbridge.runtime.approval;

import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import io.github.drompincen.tapbridge.protocol.api.RiskTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalPolicyEngineTest {

    private final ApprovalPolicyEngine engine = new ApprovalPolicyEngine();

    @Test
    void nothingIsAutoApprovedByDefault() {
        for (RiskTier tier : RiskTier.values()) {
            assertThat(engine.evaluate(tier, AutoApprovalPreferences.none())).isEqualTo(PolicyDecision.REQUIRE_HUMAN);
        }
    }

    @Test
    void eachTierFollowsItsOwnFlag() {
        AutoApprovalPreferences lowOnly = new AutoApprovalPreferences(true, false, false, false);
        assertThat(engine.evaluate(RiskTier.LOW, lowOnly)).isEqualTo(PolicyDecision.AUTO_APPROVE);
        assertThat(engine.evaluate(RiskTier.MEDIUM, lowOnly)).isEqualTo(PolicyDecision.REQUIRE_HUMAN);

        AutoApprovalPreferences highOnly = new AutoApprovalPreferences(false, false, true, false);
        assertThat(engine.evaluate(RiskTier.HIGH, highOnly)).isEqualTo(PolicyDecision.AUTO_APPROVE);
        assertThat(engine.evaluate(RiskTier.CRITICAL, highOnly)).isEqualTo(PolicyDecision.REQUIRE_HUMAN);
        assertThat(engine.evaluate(RiskTier.LOW, highOnly)).isEqualTo(PolicyDecision.REQUIRE_HUMAN);
    }

    @Test
    void criticalCanBeAutoApprovedWhenEnabled() {
        AutoApprovalPreferences all = new AutoApprovalPreferences(true, true, true, true);
        assertThat(engine.evaluate(RiskTier.CRITICAL, all)).isEqualTo(PolicyDecision.AUTO_APPROVE);
    }

    @Test
    void missingInputsRequireHuman() {
        assertThat(engine.evaluate(null, AutoApprovalPreferences.none())).isEqualTo(PolicyDecision.REQUIRE_HUMAN);
        assertThat(engine.evaluate(RiskTier.LOW, null)).isEqualTo(PolicyDecision.REQUIRE_HUMAN);
    }
}
