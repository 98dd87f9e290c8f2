package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.runtime.bridge.NotConnectedException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownApprovalRequestException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownSessionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeExceptionHandlerTest {

    private final BridgeExceptionHandler handler = new BridgeExceptionHandler();

    @Test
    void notConnectedIsConflict() {
        ResponseEntity<Map<String, String>> response = handler.notConnected(new NotConnectedException("m1"));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody()).containsEntry("machineId", "m1");
    }

    @Test
    void unknownIdsAreNotFound() {
        assertThat(handler.unknown(new UnknownSessionException("s9")).getStatusCode().value()).isEqualTo(404);
        assertThat(handler.unknown(new UnknownApprovalRequestException("r9")).getBody())
                .containsEntry("error", "Unknown approval request r9");
    }
}
