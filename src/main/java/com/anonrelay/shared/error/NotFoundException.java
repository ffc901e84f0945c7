package com.anonrelay.shared.error;

public class NotFoundException extends RelayException {

    public NotFoundException(String what, Object key) {
        super(what + " not found: " + key);
    }
}
