package io.github.drompincen.tapbridge.gateway.controller;

import io.github.drompincen.tapbridge.runtime.bridge.NotConnectedException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownApprovalRequestException;
import io.github.drompincen.tapbridge.runtime.bridge.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps bridge failures onto HTTP statuses.
 */
@RestControllerAdvice
public class BridgeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BridgeExceptionHandler.class);

    @ExceptionHandler(NotConnectedException.class)
    public ResponseEntity<Map<String, String>> notConnected(NotConnectedException e) {
        log.warn("Command refused: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", e.getMessage(), "machineId", e.getMachineId()));
    }

    @ExceptionHandler({UnknownSessionException.class, UnknownApprovalRequestException.class})
    public ResponseEntity<Map<String, String>> unknown(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
