package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record Alert(
    long id,
    AlertType type,
    Long userId,
    String details,
    boolean resolved,
    LocalDateTime createdAt
) {}
