package com.anonrelay.channels;

import com.anonrelay.shared.model.ConversationEvent;

/**
 * Receives inbound traffic from a transport. Implementations must not throw: each call is one
 * isolated event.
 */
public interface InboundSink {

    /** A start command, optionally carrying a deep-link payload. */
    void onStart(long externalUserId, String displayName, String payload);

    void onMessage(ConversationEvent event);

    /**
     * A button press.
     *
     * @return short text to show the presser, or null for none
     */
    String onCallback(long externalUserId, String displayName, String data);
}
