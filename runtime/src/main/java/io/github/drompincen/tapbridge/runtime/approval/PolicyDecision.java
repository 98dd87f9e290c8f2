package io.github.drompincen.tapbridge.runtime.approval;

public enum PolicyDecision {
    AUTO_APPROVE,
    REQUIRE_HUMAN
}
