package io.github.drompincen.tapbridge.runtime.bridge;

public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String sessionId) {
        super("Unknown session " + sessionId);
    }
}
