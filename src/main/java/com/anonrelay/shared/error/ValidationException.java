package com.anonrelay.shared.error;

/** Missing target or session state for an inbound event. */
public class ValidationException extends RelayException {

    public ValidationException(String message) {
        super(message);
    }
}
