package com.anonrelay.channels;

import com.anonrelay.shared.model.OutboundMessage;

import java.util.Optional;

/**
 * Outbound side of the transport. Implementations block until the platform answers.
 */
public interface OutboundChannel {

    /**
     * Sends content to a user or channel.
     *
     * @return the platform's reference to the sent message, if it has one
     */
    Optional<String> deliver(String target, OutboundMessage message);

    /** Plain-text notice to the operator's admin channel. */
    void notify(String adminChannel, String text);
}
