package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record Message(
    long id,
    long senderId,
    long receiverId,
    MessageContent content,
    MessageStatus status,
    boolean read,
    LocalDateTime readAt,
    Long replyToId,
    String publishedRef,
    Sentiment sentiment,
    boolean urgent,
    LocalDateTime createdAt
) {
    public boolean isReply() {
        return replyToId != null;
    }

    public Message withStatus(MessageStatus newStatus) {
        return new Message(id, senderId, receiverId, content, newStatus, read, readAt,
                replyToId, publishedRef, sentiment, urgent, createdAt);
    }

    public Message withPublishedRef(String ref) {
        return new Message(id, senderId, receiverId, content, status, read, readAt,
                replyToId, ref, sentiment, urgent, createdAt);
    }

    public Message withReadAt(LocalDateTime at) {
        return new Message(id, senderId, receiverId, content, status, true, at,
                replyToId, publishedRef, sentiment, urgent, createdAt);
    }
}
