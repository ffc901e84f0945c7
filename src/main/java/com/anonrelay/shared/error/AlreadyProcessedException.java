package com.anonrelay.shared.error;

import com.anonrelay.shared.model.MessageStatus;

public class AlreadyProcessedException extends RelayException {

    private final long messageId;
    private final MessageStatus currentStatus;

    public AlreadyProcessedException(long messageId, MessageStatus currentStatus) {
        super("Message " + messageId + " already processed (" + currentStatus + ")");
        this.messageId = messageId;
        this.currentStatus = currentStatus;
    }

    public long messageId() {
        return messageId;
    }

    public MessageStatus currentStatus() {
        return currentStatus;
    }
}
