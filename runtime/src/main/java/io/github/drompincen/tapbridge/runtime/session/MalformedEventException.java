package io.github.drompincen.tapbridge.runtime.session;

/**
 * An inbound event lacks a field its kind requires. The store drops such events.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }
}
