package io.github.drompincen.tapbridge.protocol.api;

public record DenyRequest(String reason) {}
