package com.anonrelay.shared.error;

/**
 * Base of every failure on the relay path. The event gateway turns any of these into a single
 * generic notice for the end user.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
