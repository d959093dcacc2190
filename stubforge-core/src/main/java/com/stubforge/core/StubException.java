package com.stubforge.core;

/**
 * Base type for every fatal condition raised while generating a stub.
 *
 * <p>Stub generation never recovers from these internally. Callers decide how to
 * present them (the CLI logs the message and exits with a non-zero code).
 */
public class StubException extends RuntimeException {

    public StubException(String message) {
        super(message);
    }

    public StubException(String message, Throwable cause) {
        super(message, cause);
    }
}
