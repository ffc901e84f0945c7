package com.anonrelay.shared.error;

public class DeliveryException extends RelayException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
