package com.anonrelay.shared.model;

import java.util.List;

public record OutboundMessage(
    String text,
    MessageContent.Media media,
    String replyToRef,
    List<OutboundAction> actions
) {
    public OutboundMessage {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, null, null, List.of());
    }

    public static OutboundMessage text(String text, List<OutboundAction> actions) {
        return new OutboundMessage(text, null, null, actions);
    }
}
