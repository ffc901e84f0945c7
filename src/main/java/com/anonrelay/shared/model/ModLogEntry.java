package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record ModLogEntry(
    long id,
    long moderatorId,
    ModAction action,
    Long messageId,
    Long targetUserId,
    String details,
    LocalDateTime createdAt
) {}
