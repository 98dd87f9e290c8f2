package io.github.drompincen.tapbridge.protocol.api;

public record SendMessageRequest(String content) {}
