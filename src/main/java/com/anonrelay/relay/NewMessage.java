package com.anonrelay.relay;

import com.anonrelay.shared.model.MessageContent;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.Sentiment;

import java.time.LocalDateTime;

public record NewMessage(
    long senderId,
    long receiverId,
    MessageContent content,
    MessageStatus status,
    Long replyToId,
    Sentiment sentiment,
    boolean urgent,
    LocalDateTime createdAt
) {}
