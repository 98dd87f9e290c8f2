package io.github.drompincen.tapbridge.runtime.approval;

import io.github.drompincen.tapbridge.protocol.api.AutoApprovalPreferences;
import io.github.drompincen.tapbridge.protocol.api.RiskTier;
import org.springframework.stereotype.Component;

/**
 * Risk-tiered auto-approval. The policy only ever short-circuits toward approval; anything it
 * does not approve waits for a human.
 */
@Component
public class ApprovalPolicyEngine {

    public PolicyDecision evaluate(RiskTier tier, AutoApprovalPreferences preferences) {
        if (tier == null || preferences == null) {
            return PolicyDecision.REQUIRE_HUMAN;
        }
        boolean enabled = switch (tier) {
            case LOW -> preferences.autoApproveLow();
            case MEDIUM -> preferences.autoApproveMedium();
            case HIGH -> preferences.autoApproveHigh();
            case CRITICAL -> preferences.autoApproveCritical();
        };
        return enabled ? PolicyDecision.AUTO_APPROVE : PolicyDecision.REQUIRE_HUMAN;
    }
}
