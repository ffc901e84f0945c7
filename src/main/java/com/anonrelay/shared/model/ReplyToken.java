package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record ReplyToken(
    String hash,
    long senderId,
    long receiverId,
    LocalDateTime createdAt
) {}
