package com.anonrelay.shared.model;

/**
 * Inbound message from the front-end, before routing state is applied.
 */
public record ConversationEvent(
    long externalUserId,
    String displayName,
    Kind kind,
    String text,
    MessageContent.Media media
) {
    public enum Kind { TEXT, MEDIA }

    public static ConversationEvent text(long externalUserId, String displayName, String text) {
        return new ConversationEvent(externalUserId, displayName, Kind.TEXT, text, null);
    }

    public static ConversationEvent media(long externalUserId, String displayName, MessageContent.Media media) {
        return new ConversationEvent(externalUserId, displayName, Kind.MEDIA, null, media);
    }

    public MessageContent content() {
        return kind == Kind.TEXT ? MessageContent.text(text) : media;
    }
}
